/*
* Copyright 2025 Taylor Ketterling
* Marine data collection service: wires the CO-OPS and NDBC pollers to the
* field router, the database writers and the watchdog, and owns their lifecycle.
*/
package space.ketterling.marinedata.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.config.AppConfig;
import space.ketterling.marinedata.config.ConfigurationException;
import space.ketterling.marinedata.config.Provider;
import space.ketterling.marinedata.coops.CoopsClient;
import space.ketterling.marinedata.db.MarineRecordWriter;
import space.ketterling.marinedata.db.TidePredictionRepo;
import space.ketterling.marinedata.db.Upserter;
import space.ketterling.marinedata.db.Upserters;
import space.ketterling.marinedata.fetch.HttpFetcher;
import space.ketterling.marinedata.ndbc.NdbcClient;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Entry point the host calls: {@link #start()} once, {@link #stop()} on
 * shutdown, and {@link #latestArchiveValues()} whenever it writes its own
 * archive record.
 *
 * <p>
 * A disabled or invalid configuration leaves the host untouched: start returns
 * false and no threads are created.
 * </p>
 */
public final class MarineDataService {
    private static final Logger log = LoggerFactory.getLogger(MarineDataService.class);

    private final AppConfig cfg;
    private final DataSource ds;
    private final ObjectMapper om;
    private final Clock clock;
    private final Function<Provider, HttpFetcher> fetchers;
    private final LatestValues latest = new LatestValues();

    private Watchdog watchdog;
    private boolean running;

    public MarineDataService(AppConfig cfg, DataSource ds) {
        this(cfg, ds, new ObjectMapper(), Clock.systemUTC(), HttpFetcher.sharedTransports(cfg));
    }

    public MarineDataService(AppConfig cfg, DataSource ds, ObjectMapper om, Clock clock,
            Function<Provider, HttpFetcher> fetchers) {
        this.cfg = cfg;
        this.ds = ds;
        this.om = om;
        this.clock = clock;
        this.fetchers = fetchers;
    }

    /**
     * Validates configuration, detects the database dialect and starts the
     * pollers under the watchdog.
     *
     * @return true when collection is running
     */
    public synchronized boolean start() {
        if (running)
            return true;
        if (!cfg.enabled()) {
            log.info("Marine data collection is disabled (marine.enabled=false)");
            return false;
        }
        try {
            cfg.validate();
            Upserter upserter = Upserters.select(ds, cfg.dbDialect());
            MarineRecordWriter writer = new MarineRecordWriter(ds, upserter);
            TidePredictionRepo forecast = new TidePredictionRepo(ds, upserter, cfg.forecastTable(),
                    cfg.forecastRetention(), cfg.clockZoneId());
            RecordPipeline pipeline = new RecordPipeline(new FieldRouter(cfg.fields()), writer, latest);

            checkColumns(writer);

            Watchdog wd = new Watchdog(cfg.watchdogInterval(), cfg.joinTimeout(), clock);
            if (!cfg.stations(Provider.COOPS).isEmpty()) {
                wd.register(Provider.COOPS, () -> new CoopsPoller(cfg,
                        new CoopsClient(cfg, om, fetchers.apply(Provider.COOPS), clock), pipeline, forecast, clock),
                        cfg.staleAfter(Provider.COOPS));
            }
            if (!cfg.stations(Provider.NDBC).isEmpty()) {
                wd.register(Provider.NDBC, () -> new NdbcPoller(cfg,
                        new NdbcClient(cfg, fetchers.apply(Provider.NDBC)), pipeline, clock),
                        cfg.staleAfter(Provider.NDBC));
            }
            wd.start();
            watchdog = wd;
            running = true;
            log.info("Marine data collection started: {} CO-OPS and {} NDBC station(s), {} field mapping(s)",
                    cfg.stations(Provider.COOPS).size(), cfg.stations(Provider.NDBC).size(), cfg.fields().size());
            return true;
        } catch (ConfigurationException e) {
            log.error("Marine data collection not started: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Stops the watchdog and the pollers, waiting a bounded time for each.
     */
    public synchronized void stop() {
        if (!running)
            return;
        running = false;
        watchdog.stop();
        log.info("Marine data collection stopped");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * Latest values of the fields mapped to the {@code archive} table, keyed by
     * column name.
     */
    public Map<String, Object> latestArchiveValues() {
        return latest.snapshot();
    }

    synchronized Optional<Watchdog> watchdog() {
        return Optional.ofNullable(watchdog);
    }

    private void checkColumns(MarineRecordWriter writer) {
        Map<String, Set<String>> wanted = cfg.fields().columnsByTable();
        wanted.put(cfg.forecastTable(), Set.copyOf(TidePredictionRepo.COLUMNS));
        for (Map.Entry<String, Set<String>> e : wanted.entrySet()) {
            try {
                Set<String> missing = writer.missingColumns(e.getKey(), e.getValue());
                if (!missing.isEmpty()) {
                    log.warn("Table {} is missing column(s) {}; those fields will not be stored", e.getKey(),
                            missing);
                }
            } catch (SQLException ex) {
                log.warn("Could not inspect table {}: {}", e.getKey(), ex.getMessage());
            }
        }
    }
}
