package space.ketterling.marinedata.db;

import space.ketterling.marinedata.config.AppConfig;
import space.ketterling.marinedata.config.ConfigurationException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates the pooled connection the standalone host shares with the collector.
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds a pool from {@code db.*} settings. SQLite gets a single connection
     * because it serializes writers anyway.
     */
    public static HikariDataSource createDataSource(AppConfig cfg) {
        if (cfg.dbJdbcUrl() == null || cfg.dbJdbcUrl().isBlank())
            throw new ConfigurationException("Missing db.jdbcUrl (env DB_JDBC_URL)");

        boolean sqlite = cfg.dbJdbcUrl().startsWith("jdbc:sqlite:");
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        if (!cfg.dbUsername().isBlank())
            hc.setUsername(cfg.dbUsername());
        if (!cfg.dbPassword().isBlank())
            hc.setPassword(cfg.dbPassword());
        hc.setPoolName("marinedata");
        hc.setMaximumPoolSize(sqlite ? 1 : Math.max(2, cfg.dbPoolMax()));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }
}
