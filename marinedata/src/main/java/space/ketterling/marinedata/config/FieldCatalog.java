package space.ketterling.marinedata.config;

import java.util.*;

/**
 * Read-only lookup of {@link FieldMapping}s by provider and logical field.
 */
public final class FieldCatalog {
    private static final String PREFIX = "field.";

    private final Map<Provider, Map<String, FieldMapping>> byProvider;

    public FieldCatalog(Collection<FieldMapping> mappings) {
        Map<Provider, Map<String, FieldMapping>> m = new EnumMap<>(Provider.class);
        for (FieldMapping fm : mappings) {
            Map<String, FieldMapping> forProvider = m.computeIfAbsent(fm.provider(), k -> new LinkedHashMap<>());
            if (forProvider.putIfAbsent(fm.field(), fm) != null) {
                throw new ConfigurationException(
                        "Duplicate mapping for " + fm.provider().key() + "." + fm.field());
            }
        }
        m.replaceAll((k, v) -> Collections.unmodifiableMap(v));
        this.byProvider = Collections.unmodifiableMap(m);
    }

    /**
     * Collects every {@code field.<provider>.<name>} entry from the properties.
     */
    static FieldCatalog fromProperties(Properties p) {
        List<FieldMapping> out = new ArrayList<>();
        for (String key : new TreeSet<>(p.stringPropertyNames())) {
            if (!key.startsWith(PREFIX))
                continue;
            String rest = key.substring(PREFIX.length());
            int dot = rest.indexOf('.');
            if (dot <= 0 || dot == rest.length() - 1)
                throw new ConfigurationException("Malformed field mapping key '" + key + "'");
            Provider provider = Provider.fromKey(rest.substring(0, dot));
            String field = rest.substring(dot + 1);
            out.add(FieldMapping.parse(provider, field, p.getProperty(key)));
        }
        return new FieldCatalog(out);
    }

    public Optional<FieldMapping> lookup(Provider provider, String field) {
        return Optional.ofNullable(byProvider.getOrDefault(provider, Map.of()).get(field));
    }

    public Collection<FieldMapping> forProvider(Provider provider) {
        return byProvider.getOrDefault(provider, Map.of()).values();
    }

    public boolean isEmpty() {
        return byProvider.values().stream().allMatch(Map::isEmpty);
    }

    public int size() {
        return byProvider.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Dedicated-table columns grouped by table, archive-only fields excluded.
     */
    public Map<String, Set<String>> columnsByTable() {
        Map<String, Set<String>> out = new TreeMap<>();
        for (Map<String, FieldMapping> m : byProvider.values()) {
            for (FieldMapping fm : m.values()) {
                if (fm.archiveOnly())
                    continue;
                out.computeIfAbsent(fm.table(), k -> new TreeSet<>()).add(fm.column());
            }
        }
        return out;
    }
}
