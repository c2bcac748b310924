package space.ketterling.marinedata.ingest;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last value seen for each archive-only column, for the host to merge into its
 * own archive record. Written by pollers, read by the host thread.
 */
public final class LatestValues {
    private final Map<String, Object> values = new ConcurrentHashMap<>();

    public void update(Map<String, Object> columns) {
        values.putAll(columns);
    }

    public Map<String, Object> snapshot() {
        return new TreeMap<>(values);
    }
}
