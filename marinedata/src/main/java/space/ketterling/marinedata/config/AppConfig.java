/*
* Copyright 2025 Taylor Ketterling
* Configuration for the marine data collector: providers, stations, schedules,
* watchdog thresholds, field mappings and the standalone database settings.
*/
package space.ketterling.marinedata.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.units.UnitSystem;

import java.io.InputStream;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Collector configuration loaded from environment variables, system properties
 * or application.properties.
 *
 * <p>
 * Scalar settings follow the env / {@code -D} / file precedence. Stations
 * ({@code coops.station.<id>=true}), per-station datums
 * ({@code coops.datum.<id>=MLLW}) and field mappings ({@code field.*}) are read
 * from the properties only.
 * </p>
 */
public record AppConfig(
        boolean enabled,

        // HTTP
        Duration httpTimeout,
        int retryAttempts,
        Duration retryBackoff,
        String userAgent,
        String applicationName,

        // Providers
        String coopsBaseUrl,
        String ndbcBaseUrl,
        Duration coopsMinRequestInterval,
        String defaultDatum,
        Map<String, String> stationDatums,
        int predictionDays,
        UnitSystem unitSystem,
        List<Station> stations,

        // Schedules
        Duration tick,
        Duration errorCooldown,
        Duration coopsObservationInterval,
        Duration tidePredictionInterval,
        Duration ndbcObservationInterval,
        Duration ndbcOceanInterval,

        // Watchdog / shutdown
        Duration watchdogInterval,
        Duration coopsStaleAfter,
        Duration ndbcStaleAfter,
        Duration joinTimeout,

        // Persistence
        FieldCatalog fields,
        String forecastTable,
        Duration forecastRetention,
        String dbDialect,

        // Standalone host DB
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax,

        // Time
        ZoneId clockZoneId,

        boolean logSuccess) {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /**
     * Loads configuration from application.properties on the classpath, then
     * applies env and {@code -D} overrides.
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (Exception e) {
            log.warn("Could not read application.properties, using env and defaults only: {}", e.getMessage());
        }
        return from(p);
    }

    /**
     * Builds a configuration from the given properties. Values that are present
     * but malformed raise {@link ConfigurationException}.
     */
    public static AppConfig from(Properties p) {
        boolean enabled = Boolean.parseBoolean(envOr(p, "MARINE_ENABLED", "marine.enabled", "false"));

        Duration timeout = duration(p, "HTTP_TIMEOUT", "http.timeout", "PT30S");
        int retries = integer(p, "HTTP_RETRY_ATTEMPTS", "http.retryAttempts", "3");
        Duration backoff = duration(p, "HTTP_RETRY_BACKOFF", "http.retryBackoff", "PT1S");
        String ua = envOr(p, "HTTP_USER_AGENT", "http.userAgent", "MarineData/1.0");
        String app = envOr(p, "COOPS_APPLICATION", "coops.application", "MarineData");

        String coopsUrl = envOr(p, "COOPS_BASE_URL", "coops.baseUrl",
                "https://api.tidesandcurrents.noaa.gov/api/prod/datagetter");
        String ndbcUrl = envOr(p, "NDBC_BASE_URL", "ndbc.baseUrl", "https://www.ndbc.noaa.gov/data/realtime2");
        Duration coopsSpacing = duration(p, "COOPS_MIN_REQUEST_INTERVAL", "coops.minRequestInterval", "PT5S");
        String datum = envOr(p, "COOPS_DEFAULT_DATUM", "coops.defaultDatum", "MLLW");
        int predictionDays = integer(p, "COOPS_PREDICTION_DAYS", "coops.predictionDays", "7");
        UnitSystem units = UnitSystem.parse(envOr(p, "UNIT_SYSTEM", "units.system", "US"));

        Duration tick = duration(p, "SCHED_TICK", "schedule.tick", "PT60S");
        Duration cooldown = duration(p, "SCHED_ERROR_COOLDOWN", "schedule.errorCooldown", "PT5M");
        Duration coopsObs = duration(p, "SCHED_COOPS_OBSERVATION", "schedule.coopsObservation", "PT10M");
        Duration tides = duration(p, "SCHED_TIDE_PREDICTIONS", "schedule.tidePredictions", "PT6H");
        Duration ndbcObs = duration(p, "SCHED_NDBC_OBSERVATION", "schedule.ndbcObservation", "PT1H");
        Duration ndbcOcean = duration(p, "SCHED_NDBC_OCEAN", "schedule.ndbcOcean", "PT1H");

        Duration wdInterval = duration(p, "WATCHDOG_INTERVAL", "watchdog.interval", "PT5M");
        Duration coopsStale = duration(p, "WATCHDOG_COOPS_STALE_AFTER", "watchdog.coopsStaleAfter", "PT2H");
        Duration ndbcStale = duration(p, "WATCHDOG_NDBC_STALE_AFTER", "watchdog.ndbcStaleAfter", "PT3H");
        Duration join = duration(p, "SHUTDOWN_JOIN_TIMEOUT", "shutdown.joinTimeout", "PT10S");

        String forecastTable = FieldMapping.requireIdentifier(
                envOr(p, "FORECAST_TABLE", "forecast.table", "tide_table"), "forecast table");
        Duration retention = duration(p, "FORECAST_RETENTION", "forecast.retention", "PT24H");
        String dialect = envOr(p, "DB_DIALECT", "db.dialect", "auto");

        String dbUrl = envOr(p, "DB_JDBC_URL", "db.jdbcUrl", "");
        String dbUser = envOr(p, "DB_USERNAME", "db.username", "");
        String dbPass = envOr(p, "DB_PASSWORD", "db.password", "");
        int poolMax = integer(p, "DB_POOL_MAX", "db.poolMax", "4");

        ZoneId zoneId;
        try {
            zoneId = ZoneId.of(envOr(p, "CLOCK_ZONE", "clock.zone", "UTC"));
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid clock.zone", e);
        }
        boolean logSuccess = Boolean.parseBoolean(envOr(p, "COLLECTION_LOG_SUCCESS", "collection.logSuccess", "false"));

        return new AppConfig(
                enabled,

                timeout,
                retries,
                backoff,
                ua,
                app,

                coopsUrl,
                ndbcUrl,
                coopsSpacing,
                datum,
                parseDatums(p),
                predictionDays,
                units,
                parseStations(p),

                tick,
                cooldown,
                coopsObs,
                tides,
                ndbcObs,
                ndbcOcean,

                wdInterval,
                coopsStale,
                ndbcStale,
                join,

                FieldCatalog.fromProperties(p),
                forecastTable,
                retention,
                dialect,

                dbUrl,
                dbUser,
                dbPass,
                poolMax,

                zoneId,

                logSuccess);
    }

    /**
     * Checks the sections the collector cannot run without.
     */
    public void validate() {
        if (stations.stream().noneMatch(Station::enabled))
            throw new ConfigurationException("No stations enabled (coops.station.<id>=true / ndbc.station.<id>=true)");
        if (fields.isEmpty())
            throw new ConfigurationException("No field mappings configured (field.<provider>.<name>=table,column,type)");
        if (retryAttempts < 1)
            throw new ConfigurationException("http.retryAttempts must be at least 1");
        if (predictionDays < 1)
            throw new ConfigurationException("coops.predictionDays must be at least 1");
        requirePositive(tick, "schedule.tick");
        requirePositive(watchdogInterval, "watchdog.interval");
        requirePositive(errorCooldown, "schedule.errorCooldown");
        for (Provider provider : Provider.values()) {
            // a poller in its error cooldown must not look stuck
            Duration minimum = tick.plus(errorCooldown);
            if (staleAfter(provider).compareTo(minimum) <= 0) {
                throw new ConfigurationException("watchdog." + provider.key() + "StaleAfter must exceed "
                        + "schedule.tick + schedule.errorCooldown (" + minimum + ")");
            }
        }
    }

    /**
     * Enabled stations for one provider, in configuration order.
     */
    public List<Station> stations(Provider provider) {
        List<Station> out = new ArrayList<>();
        for (Station s : stations) {
            if (s.provider() == provider && s.enabled())
                out.add(s);
        }
        return out;
    }

    public Duration staleAfter(Provider provider) {
        return provider == Provider.COOPS ? coopsStaleAfter : ndbcStaleAfter;
    }

    /**
     * Tidal datum for a CO-OPS station, falling back to the configured default.
     */
    public String datumFor(String stationId) {
        return stationDatums.getOrDefault(stationId, defaultDatum);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def).trim();
    }

    private static Duration duration(Properties p, String envKey, String propKey, String def) {
        String raw = envOr(p, envKey, propKey, def);
        try {
            return Duration.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid duration for " + propKey + ": '" + raw + "'", e);
        }
    }

    private static int integer(Properties p, String envKey, String propKey, String def) {
        String raw = envOr(p, envKey, propKey, def);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + propKey + ": '" + raw + "'", e);
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isNegative() || d.isZero())
            throw new ConfigurationException(name + " must be positive");
    }

    /**
     * Parses {@code <provider>.station.<id>=true|false} entries.
     */
    private static List<Station> parseStations(Properties p) {
        List<Station> out = new ArrayList<>();
        for (Provider provider : Provider.values()) {
            String prefix = provider.key() + ".station.";
            for (String key : new TreeSet<>(p.stringPropertyNames())) {
                if (!key.startsWith(prefix))
                    continue;
                String id = key.substring(prefix.length()).trim();
                if (id.isEmpty())
                    throw new ConfigurationException("Empty station id in '" + key + "'");
                boolean on = Boolean.parseBoolean(p.getProperty(key).trim());
                out.add(new Station(id, provider, on));
            }
        }
        return List.copyOf(out);
    }

    private static Map<String, String> parseDatums(Properties p) {
        String prefix = Provider.COOPS.key() + ".datum.";
        Map<String, String> out = new HashMap<>();
        for (String key : p.stringPropertyNames()) {
            if (key.startsWith(prefix))
                out.put(key.substring(prefix.length()).trim(), p.getProperty(key).trim());
        }
        return Map.copyOf(out);
    }
}
