/*
* Copyright 2025 Taylor Ketterling
* NDBC client for the marine data collector.
* Reads buoy standard meteorological and ocean files from the NDBC realtime2
* directory and converts readings into the configured unit system.
*/
package space.ketterling.marinedata.ndbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.config.AppConfig;
import space.ketterling.marinedata.fetch.FetchException;
import space.ketterling.marinedata.fetch.HttpFetcher;
import space.ketterling.marinedata.fetch.MalformedResponseException;
import space.ketterling.marinedata.units.MarineUnits;
import space.ketterling.marinedata.units.MarineUnits.Quantity;
import space.ketterling.marinedata.units.UnitSystem;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.*;

/**
 * Client for NDBC buoy real-time data files.
 */
public final class NdbcClient {
    private static final Logger log = LoggerFactory.getLogger(NdbcClient.class);

    /** NDBC column -> logical field and delivered quantity, standard met file. */
    static final Map<String, Column> STDMET = columns(
            new Column("WDIR", "marine_wind_direction", Quantity.PLAIN),
            new Column("WSPD", "marine_wind_speed", Quantity.SPEED),
            new Column("GST", "marine_wind_gust", Quantity.SPEED),
            new Column("WVHT", "wave_height", Quantity.LENGTH),
            new Column("DPD", "dominant_wave_period", Quantity.PLAIN),
            new Column("APD", "average_wave_period", Quantity.PLAIN),
            new Column("MWD", "mean_wave_direction", Quantity.PLAIN),
            new Column("PRES", "marine_barometric_pressure", Quantity.PRESSURE),
            new Column("PTDY", "marine_pressure_tendency", Quantity.PRESSURE),
            new Column("ATMP", "marine_air_temp", Quantity.TEMPERATURE),
            new Column("WTMP", "marine_sea_surface_temp", Quantity.TEMPERATURE),
            new Column("DEWP", "marine_dewpoint", Quantity.TEMPERATURE),
            new Column("VIS", "marine_visibility", Quantity.PLAIN));

    /** Ocean file columns. */
    static final Map<String, Column> OCEAN = columns(
            new Column("DEPTH", "ocean_depth", Quantity.LENGTH),
            new Column("OTMP", "ocean_temperature", Quantity.TEMPERATURE),
            new Column("COND", "ocean_conductivity", Quantity.PLAIN),
            new Column("SAL", "ocean_salinity", Quantity.PLAIN),
            new Column("PH", "ocean_ph", Quantity.PLAIN));

    private final AppConfig cfg;
    private final HttpFetcher fetcher;

    public NdbcClient(AppConfig cfg, HttpFetcher fetcher) {
        this.cfg = cfg;
        this.fetcher = fetcher;
    }

    /**
     * Latest standard meteorological observation ({@code <id>.txt}).
     */
    public Map<String, Object> standardMet(String stationId) throws FetchException, InterruptedException {
        String url = cfg.ndbcBaseUrl() + "/" + enc(stationId) + ".txt";
        return fetcher.fetch(url, body -> latestRow(body, STDMET, cfg.unitSystem()));
    }

    /**
     * Latest ocean observation ({@code <id>.ocean}). Many buoys have no ocean
     * sensors and answer 404.
     */
    public Map<String, Object> oceanData(String stationId) throws FetchException, InterruptedException {
        String url = cfg.ndbcBaseUrl() + "/" + enc(stationId) + ".ocean";
        return fetcher.fetch(url, body -> latestRow(body, OCEAN, cfg.unitSystem()));
    }

    /**
     * Normalizes the newest valid row of an NDBC file.
     */
    static Map<String, Object> latestRow(String body, Map<String, Column> mapping, UnitSystem units)
            throws MalformedResponseException {
        NdbcTextParser.Table table = NdbcTextParser.parse(body);
        Map<String, String> row = table.latest()
                .orElseThrow(() -> new MalformedResponseException("NDBC file has no well-formed data rows"));

        Map<String, Object> out = new LinkedHashMap<>();
        for (Column col : mapping.values()) {
            String raw = row.get(col.code());
            if (raw == null)
                continue;
            try {
                double v = Double.parseDouble(raw);
                out.put(col.field(), MarineUnits.fromMetric(v, col.quantity(), units));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric NDBC {}='{}'", col.code(), raw);
            }
        }
        Long observed = observationTime(row);
        if (observed != null)
            out.put("observation_time", observed);
        return out;
    }

    /**
     * Epoch seconds from the {@code #YY MM DD hh mm} columns (UTC).
     */
    static Long observationTime(Map<String, String> row) {
        String yy = row.getOrDefault("#YY", row.get("YY"));
        if (yy == null)
            return null;
        try {
            int year = Integer.parseInt(yy);
            if (year < 50)
                year += 2000;
            else if (year < 100)
                year += 1900;
            LocalDateTime t = LocalDateTime.of(year,
                    Integer.parseInt(row.get("MM")),
                    Integer.parseInt(row.get("DD")),
                    Integer.parseInt(row.get("hh")),
                    Integer.parseInt(row.get("mm")));
            return t.toEpochSecond(ZoneOffset.UTC);
        } catch (NumberFormatException | DateTimeException e) {
            log.debug("Unparsable NDBC observation time in row {}", row);
            return null;
        }
    }

    /**
     * One mapped NDBC column.
     */
    record Column(String code, String field, Quantity quantity) {
    }

    private static Map<String, Column> columns(Column... cols) {
        Map<String, Column> m = new LinkedHashMap<>();
        for (Column c : cols)
            m.put(c.code(), c);
        return Collections.unmodifiableMap(m);
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
