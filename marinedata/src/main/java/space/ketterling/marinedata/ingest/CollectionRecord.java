package space.ketterling.marinedata.ingest;

import space.ketterling.marinedata.config.Provider;

import java.time.Instant;
import java.util.Map;

/**
 * Normalized output of one fetch for one station: logical field name to value,
 * already in destination units. Missing readings are absent, never null.
 */
public record CollectionRecord(Provider provider, String stationId, Instant collectedAt, Map<String, Object> values) {
    public CollectionRecord {
        values = Map.copyOf(values);
    }
}
