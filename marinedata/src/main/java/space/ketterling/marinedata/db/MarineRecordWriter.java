/*
* Copyright 2025 Taylor Ketterling
* Record writer for the marine data collector.
* Upserts routed field sets into their destination tables on the shared store.
*/
package space.ketterling.marinedata.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.*;

/**
 * Writes one row per (table, station, collection time).
 *
 * <p>
 * Every destination table is keyed by {@code (dateTime, station_id)} with
 * {@code dateTime} in epoch seconds. A repeated write for the same key
 * updates the columns it carries and leaves the others as stored.
 * </p>
 */
public class MarineRecordWriter {
    private static final Logger log = LoggerFactory.getLogger(MarineRecordWriter.class);

    public static final String TIME_COLUMN = "dateTime";
    public static final String STATION_COLUMN = "station_id";
    static final List<String> KEY_COLUMNS = List.of(TIME_COLUMN, STATION_COLUMN);

    private final DataSource ds;
    private final Upserter upserter;

    public MarineRecordWriter(DataSource ds, Upserter upserter) {
        this.ds = ds;
        this.upserter = upserter;
    }

    /**
     * Upserts the given columns plus the implicit timestamp and station id.
     * SQL failures are logged and reported, never thrown.
     */
    public WriteResult persist(String table, String stationId, Instant collectedAt, Map<String, Object> columns) {
        if (columns == null || columns.isEmpty())
            return WriteResult.skipped(table, "no values");

        List<String> names = new ArrayList<>(KEY_COLUMNS);
        List<Object> values = new ArrayList<>();
        values.add(collectedAt.getEpochSecond());
        values.add(stationId);
        for (Map.Entry<String, Object> e : columns.entrySet()) {
            names.add(e.getKey());
            values.add(e.getValue());
        }

        String sql = upserter.upsertSql(table, KEY_COLUMNS, names);
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < values.size(); i++)
                bind(ps, i + 1, values.get(i));
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("Write to {} failed for station={} err={}", table, stationId, e.getMessage());
            return WriteResult.failed(table, e.getMessage());
        }
        log.debug("persist: table={} station={} dateTime={} columns={}", table, stationId,
                collectedAt.getEpochSecond(), columns.keySet());
        return WriteResult.written(table, 1);
    }

    /**
     * Columns from {@code wanted} that {@code table} does not have. All of them
     * when the table itself is missing.
     */
    public Set<String> missingColumns(String table, Collection<String> wanted) throws SQLException {
        Set<String> existing = new HashSet<>();
        try (Connection c = ds.getConnection()) {
            DatabaseMetaData md = c.getMetaData();
            for (String candidate : List.of(table, table.toLowerCase(Locale.ROOT), table.toUpperCase(Locale.ROOT))) {
                try (ResultSet rs = md.getColumns(null, null, candidate, null)) {
                    while (rs.next())
                        existing.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                }
                if (!existing.isEmpty())
                    break;
            }
        }
        Set<String> missing = new TreeSet<>();
        for (String col : wanted) {
            if (!existing.contains(col.toLowerCase(Locale.ROOT)))
                missing.add(col);
        }
        return missing;
    }

    /**
     * Binds a routed value by its Java type.
     */
    static void bind(PreparedStatement ps, int idx, Object v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.NULL);
        else if (v instanceof Double || v instanceof Float)
            ps.setDouble(idx, ((Number) v).doubleValue());
        else if (v instanceof Long || v instanceof Integer)
            ps.setLong(idx, ((Number) v).longValue());
        else
            ps.setString(idx, v.toString());
    }
}
