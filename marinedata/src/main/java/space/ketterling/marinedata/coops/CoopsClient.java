/*
* Copyright 2025 Taylor Ketterling
* CO-OPS client for the marine data collector.
* Reads water levels, water temperature and high/low tide predictions from the
* NOAA Tides & Currents data API and normalizes them into logical fields.
*/
package space.ketterling.marinedata.coops;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.config.AppConfig;
import space.ketterling.marinedata.fetch.FetchException;
import space.ketterling.marinedata.fetch.HttpFetcher;
import space.ketterling.marinedata.fetch.MalformedResponseException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Client for the NOAA CO-OPS data getter API.
 *
 * <p>
 * Values are requested in the configured unit system ({@code units=english} or
 * {@code metric}) so no conversion is needed downstream. A JSON body carrying
 * an {@code error} object is treated as a malformed response and retried.
 * </p>
 */
public final class CoopsClient {
    private static final Logger log = LoggerFactory.getLogger(CoopsClient.class);

    /** CO-OPS GMT timestamps, e.g. {@code 2025-01-31 20:42}. */
    static final DateTimeFormatter COOPS_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter DATE_PARAM = DateTimeFormatter.BASIC_ISO_DATE;

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final HttpFetcher fetcher;
    private final Clock clock;

    public CoopsClient(AppConfig cfg, ObjectMapper om, HttpFetcher fetcher, Clock clock) {
        this.cfg = cfg;
        this.om = om;
        this.fetcher = fetcher;
        this.clock = clock;
    }

    /**
     * Latest observed water level relative to the station datum.
     *
     * <p>
     * Returns {@code water_level}, {@code water_level_sigma},
     * {@code water_level_flags}, {@code water_level_quality} and
     * {@code water_level_time} (epoch seconds). Empty when the station reported
     * nothing.
     * </p>
     */
    public Map<String, Object> waterLevel(String stationId) throws FetchException, InterruptedException {
        String url = baseQuery("water_level", stationId)
                + "&date=latest"
                + "&datum=" + enc(cfg.datumFor(stationId));

        return fetcher.fetch(url, body -> {
            JsonNode latest = firstDataPoint(body);
            Map<String, Object> out = new LinkedHashMap<>();
            if (latest == null)
                return out;
            putDouble(out, "water_level", latest.get("v"));
            putDouble(out, "water_level_sigma", latest.get("s"));
            putText(out, "water_level_flags", latest.get("f"));
            putText(out, "water_level_quality", latest.get("q"));
            putTime(out, "water_level_time", latest.get("t"));
            return out;
        });
    }

    /**
     * Latest water temperature, for stations that carry the sensor.
     *
     * <p>
     * Returns {@code water_temperature}, {@code water_temperature_flags} and
     * {@code water_temperature_time}.
     * </p>
     */
    public Map<String, Object> waterTemperature(String stationId) throws FetchException, InterruptedException {
        String url = baseQuery("water_temperature", stationId) + "&date=latest";

        return fetcher.fetch(url, body -> {
            JsonNode latest = firstDataPoint(body);
            Map<String, Object> out = new LinkedHashMap<>();
            if (latest == null)
                return out;
            putDouble(out, "water_temperature", latest.get("v"));
            putText(out, "water_temperature_flags", latest.get("f"));
            putTime(out, "water_temperature_time", latest.get("t"));
            return out;
        });
    }

    /**
     * High/low predictions from today through {@code coops.predictionDays}.
     */
    public List<TidePrediction> tidePredictions(String stationId) throws FetchException, InterruptedException {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        String datum = cfg.datumFor(stationId);
        String url = baseQuery("predictions", stationId)
                + "&begin_date=" + today.format(DATE_PARAM)
                + "&end_date=" + today.plusDays(cfg.predictionDays()).format(DATE_PARAM)
                + "&interval=hilo"
                + "&datum=" + enc(datum);

        List<TidePrediction> predictions = fetcher.fetch(url, body -> {
            JsonNode root = readChecked(body);
            JsonNode rows = root.path("predictions");
            if (!rows.isArray())
                throw new MalformedResponseException("CO-OPS response has no predictions array");
            List<TidePrediction> out = new ArrayList<>();
            for (JsonNode row : rows) {
                TidePrediction.TideType type = TidePrediction.TideType.fromCoops(row.path("type").asText(null));
                Double height = toDouble(row.get("v"));
                Instant at = toInstant(row.get("t"));
                if (type == null || height == null || at == null) {
                    log.debug("Skipping incomplete prediction row for {}: {}", stationId, row);
                    continue;
                }
                out.add(new TidePrediction(stationId, at, type, height, datum));
            }
            return out;
        });
        log.debug("CO-OPS predictions for {}: {} rows", stationId, predictions.size());
        return predictions;
    }

    /**
     * Summarizes the next high and low tide after {@code now}.
     *
     * <p>
     * Produces {@code next_high_time}, {@code next_high_level},
     * {@code next_low_time}, {@code next_low_level} and, when both are known,
     * {@code tidal_range}. Times are rendered in CO-OPS GMT form.
     * </p>
     */
    public static Map<String, Object> nextTides(List<TidePrediction> predictions, Instant now) {
        TidePrediction high = null;
        TidePrediction low = null;
        List<TidePrediction> sorted = new ArrayList<>(predictions);
        sorted.sort(Comparator.comparing(TidePrediction::predictedAt));
        for (TidePrediction p : sorted) {
            if (!p.predictedAt().isAfter(now))
                continue;
            if (p.type() == TidePrediction.TideType.HIGH && high == null)
                high = p;
            if (p.type() == TidePrediction.TideType.LOW && low == null)
                low = p;
            if (high != null && low != null)
                break;
        }

        Map<String, Object> out = new LinkedHashMap<>();
        if (high != null) {
            out.put("next_high_time", COOPS_TIME.format(high.predictedAt().atOffset(ZoneOffset.UTC)));
            out.put("next_high_level", high.height());
        }
        if (low != null) {
            out.put("next_low_time", COOPS_TIME.format(low.predictedAt().atOffset(ZoneOffset.UTC)));
            out.put("next_low_level", low.height());
        }
        if (high != null && low != null)
            out.put("tidal_range", Math.abs(high.height() - low.height()));
        return out;
    }

    // ----------------------------
    // helpers
    // ----------------------------
    private String baseQuery(String product, String stationId) {
        return cfg.coopsBaseUrl()
                + "?product=" + enc(product)
                + "&application=" + enc(cfg.applicationName())
                + "&station=" + enc(stationId)
                + "&units=" + cfg.unitSystem().coopsUnits()
                + "&time_zone=gmt"
                + "&format=json";
    }

    private JsonNode readChecked(String body) throws MalformedResponseException {
        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("CO-OPS invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject())
            throw new MalformedResponseException("CO-OPS response is not a JSON object");
        JsonNode error = root.get("error");
        if (error != null) {
            String msg = error.path("message").asText(error.toString());
            throw new MalformedResponseException("CO-OPS error: " + msg);
        }
        return root;
    }

    /**
     * Most recent entry of the {@code data} array, or null if it is empty.
     */
    private JsonNode firstDataPoint(String body) throws MalformedResponseException {
        JsonNode data = readChecked(body).path("data");
        if (!data.isArray())
            throw new MalformedResponseException("CO-OPS response has no data array");
        return data.size() == 0 ? null : data.get(0);
    }

    private static void putDouble(Map<String, Object> out, String field, JsonNode n) {
        Double v = toDouble(n);
        if (v != null)
            out.put(field, v);
    }

    private static void putText(Map<String, Object> out, String field, JsonNode n) {
        if (n != null && !n.isNull() && !n.asText().isBlank())
            out.put(field, n.asText());
    }

    private static void putTime(Map<String, Object> out, String field, JsonNode n) {
        Instant at = toInstant(n);
        if (at != null)
            out.put(field, at.getEpochSecond());
    }

    /**
     * CO-OPS sends numbers as strings and uses "" for missing readings.
     */
    static Double toDouble(JsonNode n) {
        if (n == null || n.isNull())
            return null;
        if (n.isNumber())
            return n.doubleValue();
        String s = n.asText().trim();
        if (s.isEmpty())
            return null;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric CO-OPS value '{}'", s);
            return null;
        }
    }

    static Instant toInstant(JsonNode n) {
        if (n == null || n.isNull() || n.asText().isBlank())
            return null;
        try {
            return LocalDateTime.parse(n.asText().trim(), COOPS_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparsable CO-OPS time '{}'", n.asText());
            return null;
        }
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
