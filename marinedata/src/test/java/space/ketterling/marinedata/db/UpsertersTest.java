package space.ketterling.marinedata.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import space.ketterling.marinedata.SqliteTestDb;
import space.ketterling.marinedata.config.ConfigurationException;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class UpsertersTest {

    private static final List<String> KEYS = List.of("dateTime", "station_id");
    private static final List<String> COLS = List.of("dateTime", "station_id", "wave_height");

    @Test
    void shouldBuildSqliteOnConflict() {
        assertThat(new SqliteUpserter().upsertSql("ndbc_data", KEYS, COLS))
                .isEqualTo("INSERT INTO ndbc_data (dateTime, station_id, wave_height) VALUES (?, ?, ?)"
                        + " ON CONFLICT (dateTime, station_id) DO UPDATE SET wave_height=excluded.wave_height");
        assertThat(new SqliteUpserter().upsertSql("t", KEYS, KEYS)).endsWith("DO NOTHING");
    }

    @Test
    void shouldBuildMySqlOnDuplicateKey() {
        assertThat(new MySqlUpserter().upsertSql("ndbc_data", KEYS, COLS))
                .isEqualTo("INSERT INTO ndbc_data (dateTime, station_id, wave_height) VALUES (?, ?, ?)"
                        + " ON DUPLICATE KEY UPDATE wave_height=VALUES(wave_height)");
        assertThat(new MySqlUpserter().upsertSql("t", KEYS, KEYS)).startsWith("INSERT IGNORE INTO t ");
    }

    @Test
    void shouldBuildPostgresOnConflict() {
        assertThat(new PostgresUpserter().upsertSql("ndbc_data", KEYS, COLS))
                .isEqualTo("INSERT INTO ndbc_data (dateTime, station_id, wave_height) VALUES (?, ?, ?)"
                        + " ON CONFLICT (dateTime, station_id) DO UPDATE SET wave_height=EXCLUDED.wave_height");
        assertThat(new PostgresUpserter().upsertSql("t", KEYS, KEYS)).endsWith("DO NOTHING");
    }

    @Test
    void shouldResolveDialectNames() {
        assertThat(Upserters.forName("SQLite")).isInstanceOf(SqliteUpserter.class);
        assertThat(Upserters.forName("MariaDB")).isInstanceOf(MySqlUpserter.class);
        assertThat(Upserters.forName("MySQL")).isInstanceOf(MySqlUpserter.class);
        assertThat(Upserters.forName("PostgreSQL")).isInstanceOf(PostgresUpserter.class);
        assertThatThrownBy(() -> Upserters.forName("Oracle")).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldDetectDialectFromConnection(@TempDir Path dir) {
        try (SqliteTestDb db = new SqliteTestDb(dir)) {
            assertThat(Upserters.select(db.dataSource(), "auto")).isInstanceOf(SqliteUpserter.class);
            assertThat(Upserters.select(db.dataSource(), "postgres")).isInstanceOf(PostgresUpserter.class);
        }
    }
}
