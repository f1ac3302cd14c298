package de.t14d3.drawer.storage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes key-value rows of one or more namespace tables.
 *
 * Implementations wrap engine failures into {@link de.t14d3.drawer.exceptions.DatabaseException}
 * with the cause preserved and never retry.
 */
public interface PersistenceBackend {

    /**
     * Create the namespace table if it does not exist yet.
     */
    void ensureTable(String table);

    Optional<StoredValue> read(String table, String key);

    /**
     * @return the stored values of those {@code keys} that exist; missing keys are left out
     */
    Map<String, Object> readMany(String table, Collection<String> keys);

    Map<String, Object> readAll(String table);

    void write(String table, String key, Object value);

    /**
     * Write every entry in one engine transaction, or inside the active user transaction if there is one.
     */
    void writeAll(String table, Map<String, ?> values);

    /**
     * @return {@code true} if a row was removed
     */
    boolean delete(String table, String key);

    /**
     * @return number of rows removed
     */
    int deleteAll(String table, Collection<String> keys);

    boolean exists(String table, String key);

    List<String> keys(String table);

    int count(String table);

    void clear(String table);
}
