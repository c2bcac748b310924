package space.ketterling.marinedata.db;

import java.util.List;

/**
 * SQLite 3.24+: {@code INSERT ... ON CONFLICT (key) DO UPDATE}.
 */
public final class SqliteUpserter implements Upserter {
    @Override
    public String dialect() {
        return "sqlite";
    }

    @Override
    public String upsertSql(String table, List<String> keyColumns, List<String> columns) {
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(table).append(' ')
                .append(Upserter.columnsAndValues(columns))
                .append(" ON CONFLICT (").append(String.join(", ", keyColumns)).append(") ");

        String set = Upserter.assignments(keyColumns, columns, "excluded.", "");
        if (set.isEmpty())
            return sql.append("DO NOTHING").toString();
        return sql.append("DO UPDATE SET ").append(set).toString();
    }
}
