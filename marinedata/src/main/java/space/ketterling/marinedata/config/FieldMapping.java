package space.ketterling.marinedata.config;

import java.util.regex.Pattern;

/**
 * Destination of one logical field collected from a provider.
 *
 * <p>
 * Parsed from a property of the form
 * {@code field.<provider>.<logicalField>=<table>,<column>,<REAL|TEXT>}.
 * </p>
 */
public record FieldMapping(Provider provider, String field, String table, String column, ValueType type) {

    /**
     * Table name meaning "no dedicated table": the host's own archive record
     * carries the value, so the collector never writes it.
     */
    public static final String ARCHIVE_TABLE = "archive";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Storage type of a mapped column.
     */
    public enum ValueType {
        REAL,
        TEXT;

        static ValueType parse(String raw) {
            String t = raw.trim().toUpperCase();
            // MySQL-style declarations from older configs
            if (t.startsWith("VARCHAR") || t.equals("STRING"))
                return TEXT;
            if (t.equals("DOUBLE") || t.equals("FLOAT") || t.equals("NUMERIC"))
                return REAL;
            try {
                return valueOf(t);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unsupported value type '" + raw + "'", e);
            }
        }
    }

    public boolean archiveOnly() {
        return ARCHIVE_TABLE.equalsIgnoreCase(table);
    }

    /**
     * Parses the right-hand side of a field mapping property.
     */
    public static FieldMapping parse(Provider provider, String field, String spec) {
        if (spec == null || spec.isBlank())
            throw new ConfigurationException("Empty mapping for " + provider.key() + "." + field);
        String[] bits = spec.split(",");
        if (bits.length != 3)
            throw new ConfigurationException("Mapping for " + provider.key() + "." + field
                    + " must be 'table,column,type' but was '" + spec + "'");
        String table = requireIdentifier(bits[0].trim(), "table");
        String column = requireIdentifier(bits[1].trim(), "column");
        return new FieldMapping(provider, field, table, column, ValueType.parse(bits[2]));
    }

    /**
     * Table and column names are spliced into SQL, so only plain identifiers pass.
     */
    public static String requireIdentifier(String name, String what) {
        if (name == null || !IDENTIFIER.matcher(name).matches())
            throw new ConfigurationException("Invalid " + what + " name '" + name + "'");
        return name;
    }
}
