package de.t14d3.drawer.query;

import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Locale;

/**
 * Embedded engines the store can run on, with the SQL that differs between them.
 */
public enum Dialect {
    SQLITE,
    H2;

    /**
     * Quote an identifier based on the dialect.
     *
     * H2 folds the quoted name to upper case, so on H2 names that differ only by case
     * refer to the same object. SQLite keeps the name as given.
     */
    public String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.trim().isEmpty()) {
            return identifier;
        }

        return switch (this) {
            case SQLITE -> "\"" + identifier.replace("\"", "\"\"") + "\"";
            case H2 -> ("\"" + identifier.replace("\"", "\"\"") + "\"").toUpperCase(Locale.ROOT);
        };
    }

    /**
     * DDL for a key-value namespace table.
     */
    public String createKeyValueTable(String table) {
        String key = quoteIdentifier("key");
        String value = quoteIdentifier("value");
        return switch (this) {
            case SQLITE -> "CREATE TABLE IF NOT EXISTS " + quoteIdentifier(table)
                    + " (" + key + " TEXT PRIMARY KEY, " + value + " TEXT)";
            case H2 -> "CREATE TABLE IF NOT EXISTS " + quoteIdentifier(table)
                    + " (" + key + " VARCHAR(1024) PRIMARY KEY, " + value + " CLOB)";
        };
    }

    /**
     * Insert-or-replace of one {@code (key, value)} row, parameters in that order.
     */
    public String upsert(String table) {
        String key = quoteIdentifier("key");
        String value = quoteIdentifier("value");
        return switch (this) {
            case SQLITE -> "INSERT OR REPLACE INTO " + quoteIdentifier(table)
                    + " (" + key + ", " + value + ") VALUES (?, ?)";
            case H2 -> "MERGE INTO " + quoteIdentifier(table)
                    + " (" + key + ", " + value + ") KEY (" + key + ") VALUES (?, ?)";
        };
    }

    public boolean supportsPragmas() {
        return this == SQLITE;
    }

    /**
     * Open a connection that refuses writes, for the parallel read pool.
     * SQLite enforces this at the engine; H2 only receives the read-only hint.
     */
    public Connection openReadOnly(String jdbcUrl, Duration busyTimeout) throws SQLException {
        return switch (this) {
            case SQLITE -> {
                SQLiteConfig config = new SQLiteConfig();
                config.setReadOnly(true);
                if (busyTimeout != null) {
                    config.setBusyTimeout((int) busyTimeout.toMillis());
                }
                yield DriverManager.getConnection(jdbcUrl, config.toProperties());
            }
            case H2 -> {
                Connection connection = DriverManager.getConnection(jdbcUrl);
                connection.setReadOnly(true);
                yield connection;
            }
        };
    }

    /**
     * Detect dialect from JDBC URL.
     *
     * @throws IllegalArgumentException for engines other than SQLite and H2
     */
    public static Dialect detectFromUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            throw new IllegalArgumentException("JDBC URL must not be null");
        }

        String lowerUrl = jdbcUrl.toLowerCase();
        if (lowerUrl.startsWith("jdbc:sqlite:")) return SQLITE;
        if (lowerUrl.startsWith("jdbc:h2:")) return H2;

        throw new IllegalArgumentException("Unsupported embedded engine: " + jdbcUrl);
    }
}
