package space.ketterling.marinedata.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.config.FieldCatalog;
import space.ketterling.marinedata.config.FieldMapping;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Groups a record's fields by destination table using the configured
 * {@link FieldCatalog}.
 *
 * <p>
 * Unmapped fields and values that do not fit the mapped type are reported as
 * skipped; they are never written to some other table. Fields mapped to the
 * {@code archive} sentinel are skipped for the database and returned
 * separately for the host.
 * </p>
 */
public final class FieldRouter {
    private static final Logger log = LoggerFactory.getLogger(FieldRouter.class);

    private final FieldCatalog catalog;
    // one warning per provider.field, repeats go to debug
    private final Set<String> warned = ConcurrentHashMap.newKeySet();

    public FieldRouter(FieldCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Why a field was left out.
     */
    public enum SkipReason {
        UNMAPPED,
        ARCHIVE_ONLY,
        TYPE_MISMATCH
    }

    public record Skipped(String field, SkipReason reason) {
    }

    /**
     * Routing result.
     *
     * @param tables  table to (column to value), dedicated tables only
     * @param archive column to value for archive-only fields
     */
    public record RoutedRecord(Map<String, Map<String, Object>> tables, Map<String, Object> archive,
            List<Skipped> skipped) {
    }

    public RoutedRecord route(CollectionRecord record) {
        Map<String, Map<String, Object>> tables = new TreeMap<>();
        Map<String, Object> archive = new LinkedHashMap<>();
        List<Skipped> skipped = new ArrayList<>();

        for (Map.Entry<String, Object> e : record.values().entrySet()) {
            String field = e.getKey();
            Optional<FieldMapping> mapping = catalog.lookup(record.provider(), field);
            if (mapping.isEmpty()) {
                skipped.add(new Skipped(field, SkipReason.UNMAPPED));
                warnOnce(record.provider().key() + "." + field, "No field mapping for {}.{}, value not stored",
                        record.provider().key(), field);
                continue;
            }
            FieldMapping fm = mapping.get();
            Object value = coerce(e.getValue(), fm.type());
            if (value == null) {
                skipped.add(new Skipped(field, SkipReason.TYPE_MISMATCH));
                warnOnce(record.provider().key() + "." + field + ":" + fm.type(),
                        "Value '{}' for {}.{} does not fit {} column {}.{}", e.getValue(), record.provider().key(),
                        field, fm.type(), fm.table(), fm.column());
                continue;
            }
            if (fm.archiveOnly()) {
                archive.put(fm.column(), value);
                skipped.add(new Skipped(field, SkipReason.ARCHIVE_ONLY));
            } else {
                tables.computeIfAbsent(fm.table(), k -> new LinkedHashMap<>()).put(fm.column(), value);
            }
        }
        return new RoutedRecord(tables, archive, skipped);
    }

    /**
     * Converts a value to the column type, or null when it cannot be.
     */
    static Object coerce(Object value, FieldMapping.ValueType type) {
        if (value == null)
            return null;
        if (type == FieldMapping.ValueType.TEXT)
            return value.toString();
        if (value instanceof Number)
            return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private void warnOnce(String key, String format, Object... args) {
        if (warned.add(key))
            log.warn(format, args);
        else
            log.debug(format, args);
    }
}
