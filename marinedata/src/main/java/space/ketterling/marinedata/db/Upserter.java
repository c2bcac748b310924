package space.ketterling.marinedata.db;

import java.util.List;

/**
 * Builds the dialect's insert-or-replace statement. One implementation per
 * supported store, chosen once at startup by {@link Upserters}.
 */
public interface Upserter {

    /**
     * Short dialect name for logs.
     */
    String dialect();

    /**
     * SQL with one {@code ?} per entry of {@code columns}, in order. A second
     * upsert with the same key values overwrites only the columns it names;
     * columns it leaves out keep their stored values.
     *
     * @param keyColumns primary key columns, all contained in {@code columns}
     */
    String upsertSql(String table, List<String> keyColumns, List<String> columns);

    /**
     * Comma-separated column list and matching placeholders.
     */
    /**
     * {@code c=<prefix>c} for each non-key column, comma-separated. Empty when
     * every column is part of the key.
     */
    static String assignments(List<String> keyColumns, List<String> columns, String prefix, String suffix) {
        StringBuilder set = new StringBuilder();
        for (String c : columns) {
            if (keyColumns.contains(c))
                continue;
            if (set.length() > 0)
                set.append(", ");
            set.append(c).append('=').append(prefix).append(c).append(suffix);
        }
        return set.toString();
    }

    static String columnsAndValues(List<String> columns) {
        StringBuilder cols = new StringBuilder();
        StringBuilder marks = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                cols.append(", ");
                marks.append(", ");
            }
            cols.append(columns.get(i));
            marks.append('?');
        }
        return "(" + cols + ") VALUES (" + marks + ")";
    }
}
