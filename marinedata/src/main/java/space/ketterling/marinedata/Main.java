/*
* Copyright 2025 Taylor Ketterling
* Standalone host for the marine data collector.
*
* Loads configuration, opens the shared connection pool, starts collection and
* keeps the process alive until it is terminated. The shutdown hook stops the
* pollers before the pool is closed.
*/

package space.ketterling.marinedata;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.config.AppConfig;
import space.ketterling.marinedata.db.Database;
import space.ketterling.marinedata.ingest.MarineDataService;

import java.util.concurrent.CountDownLatch;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting marine data collector");
        AppConfig cfg = AppConfig.load();

        HikariDataSource ds = Database.createDataSource(cfg);
        MarineDataService service = new MarineDataService(cfg, ds);
        if (!service.start()) {
            log.info("Nothing to collect, exiting");
            ds.close();
            return;
        }

        // pollers run on daemon threads; hold the JVM open until shutdown
        CountDownLatch done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                service.stop();
                ds.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            } finally {
                done.countDown();
            }
        }, "marine-shutdown"));
        done.await();
    }
}
