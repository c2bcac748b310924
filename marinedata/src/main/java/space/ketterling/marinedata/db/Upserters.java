package space.ketterling.marinedata.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.marinedata.config.ConfigurationException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Selects the {@link Upserter} for the shared store.
 */
public final class Upserters {
    private static final Logger log = LoggerFactory.getLogger(Upserters.class);

    private Upserters() {
    }

    /**
     * Resolves a dialect name or JDBC product name.
     */
    public static Upserter forName(String name) {
        String n = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        if (n.contains("sqlite"))
            return new SqliteUpserter();
        if (n.contains("mysql") || n.contains("mariadb"))
            return new MySqlUpserter();
        if (n.contains("postgres"))
            return new PostgresUpserter();
        throw new ConfigurationException("Unsupported database dialect '" + name + "'");
    }

    /**
     * Uses the configured dialect, or asks the driver when it is {@code auto}.
     * Called once per service start; the result is kept for its lifetime.
     */
    public static Upserter select(DataSource ds, String configured) {
        if (configured != null && !configured.isBlank() && !configured.equalsIgnoreCase("auto"))
            return forName(configured);
        try (Connection c = ds.getConnection()) {
            String product = c.getMetaData().getDatabaseProductName();
            Upserter u = forName(product);
            log.info("Detected database product '{}', using {} upserts", product, u.dialect());
            return u;
        } catch (SQLException e) {
            throw new ConfigurationException("Could not detect database dialect: " + e.getMessage(), e);
        }
    }
}
