package space.ketterling.marinedata.db;

import java.util.List;

/**
 * MySQL and MariaDB: {@code INSERT ... ON DUPLICATE KEY UPDATE}.
 */
public final class MySqlUpserter implements Upserter {
    @Override
    public String dialect() {
        return "mysql";
    }

    @Override
    public String upsertSql(String table, List<String> keyColumns, List<String> columns) {
        String insert = "INSERT INTO " + table + " " + Upserter.columnsAndValues(columns);
        String set = Upserter.assignments(keyColumns, columns, "VALUES(", ")");
        if (set.isEmpty())
            return "INSERT IGNORE INTO " + table + " " + Upserter.columnsAndValues(columns);
        return insert + " ON DUPLICATE KEY UPDATE " + set;
    }
}
