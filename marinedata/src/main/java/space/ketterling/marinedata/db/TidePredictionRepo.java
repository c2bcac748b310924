/*
* Copyright 2025 Taylor Ketterling
* Tide prediction repository for the marine data collector.
* Keeps a rolling forecast window per station: prune stale rows, upsert fresh ones.
*/
package space.ketterling.marinedata.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.coops.TidePrediction;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Database access for the forecast (tide prediction) table.
 *
 * <p>
 * Row key is {@code (dateTime, station_id)} where {@code dateTime} is the
 * predicted time in epoch seconds.
 * </p>
 */
public class TidePredictionRepo {
    private static final Logger log = LoggerFactory.getLogger(TidePredictionRepo.class);

    public static final List<String> COLUMNS = List.of(
            MarineRecordWriter.TIME_COLUMN, MarineRecordWriter.STATION_COLUMN,
            "tide_type", "predicted_height", "datum", "days_ahead", "generated_time");

    private final DataSource ds;
    private final Upserter upserter;
    private final String table;
    private final Duration retention;
    private final ZoneId zone;

    public TidePredictionRepo(DataSource ds, Upserter upserter, String table, Duration retention, ZoneId zone) {
        this.ds = ds;
        this.upserter = upserter;
        this.table = table;
        this.retention = retention;
        this.zone = zone;
    }

    public String table() {
        return table;
    }

    /**
     * Deletes the station's predictions older than {@code now - retention}, then
     * upserts {@code predictions}, in one transaction. Failures are logged and
     * reported.
     */
    public WriteResult replaceForecast(String stationId, List<TidePrediction> predictions, Instant now) {
        long cutoff = now.minus(retention).getEpochSecond();
        String deleteSql = "DELETE FROM " + table + " WHERE " + MarineRecordWriter.STATION_COLUMN + "=? AND "
                + MarineRecordWriter.TIME_COLUMN + " < ?";
        String upsertSql = upserter.upsertSql(table, MarineRecordWriter.KEY_COLUMNS, COLUMNS);

        try (Connection c = ds.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                int pruned;
                try (PreparedStatement del = c.prepareStatement(deleteSql)) {
                    del.setString(1, stationId);
                    del.setLong(2, cutoff);
                    pruned = del.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(upsertSql)) {
                    for (TidePrediction p : predictions) {
                        ps.setLong(1, p.predictedAt().getEpochSecond());
                        ps.setString(2, stationId);
                        ps.setString(3, p.type().code());
                        ps.setDouble(4, p.height());
                        ps.setString(5, p.datum());
                        ps.setInt(6, daysAhead(p.predictedAt(), now, zone));
                        ps.setLong(7, now.getEpochSecond());
                        ps.addBatch();
                    }
                    if (!predictions.isEmpty())
                        ps.executeBatch();
                }
                c.commit();
                log.debug("replaceForecast: station={} pruned={} upserted={}", stationId, pruned,
                        predictions.size());
                return new WriteResult(table, WriteResult.Status.WRITTEN, predictions.size(), "pruned=" + pruned);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.warn("Forecast write to {} failed for station={} err={}", table, stationId, e.getMessage());
            return WriteResult.failed(table, e.getMessage());
        }
    }

    /**
     * Calendar days from today to the prediction's date in the clock zone.
     * Negative for predictions dated before today.
     */
    public static int daysAhead(Instant predictedAt, Instant now, ZoneId zone) {
        return (int) ChronoUnit.DAYS.between(now.atZone(zone).toLocalDate(), predictedAt.atZone(zone).toLocalDate());
    }
}
