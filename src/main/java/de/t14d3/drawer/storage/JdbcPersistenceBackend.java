package de.t14d3.drawer.storage;

import de.t14d3.drawer.connection.ConnectionBroker;
import de.t14d3.drawer.query.Dialect;
import de.t14d3.drawer.serialization.ValueCodec;
import de.t14d3.drawer.serialization.ValueEncryptor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link PersistenceBackend} on the broker's writer connection.
 *
 * Every call runs under the broker mutex. Values are encoded by the {@link ValueCodec}
 * and then passed through the {@link ValueEncryptor} before they reach the engine.
 */
public class JdbcPersistenceBackend implements PersistenceBackend {
    // keeps IN (...) lists below the engines' bound parameter limits
    static final int CHUNK_SIZE = 500;

    private final ConnectionBroker broker;
    private final Dialect dialect;
    private final ValueCodec codec;
    private final ValueEncryptor encryptor;
    private final String keyColumn;
    private final String valueColumn;

    public JdbcPersistenceBackend(ConnectionBroker broker, ValueCodec codec, ValueEncryptor encryptor) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.dialect = broker.dialect();
        this.codec = Objects.requireNonNull(codec, "codec");
        this.encryptor = encryptor == null ? ValueEncryptor.NONE : encryptor;
        this.keyColumn = dialect.quoteIdentifier("key");
        this.valueColumn = dialect.quoteIdentifier("value");
    }

    @Override
    public void ensureTable(String table) {
        String sql = dialect.createKeyValueTable(table);
        broker.withLock(connection -> {
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(sql);
            }
            return null;
        });
    }

    @Override
    public Optional<StoredValue> read(String table, String key) {
        String sql = "SELECT " + valueColumn + " FROM " + quote(table) + " WHERE " + keyColumn + " = ?";
        return broker.withLock(connection -> {
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                stmt.setString(1, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new StoredValue(decode(rs.getString(1))));
                }
            }
        });
    }

    @Override
    public Map<String, Object> readMany(String table, Collection<String> keys) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return result;
        }
        List<String> ordered = new ArrayList<>(keys);
        broker.withLock(connection -> {
            for (int from = 0; from < ordered.size(); from += CHUNK_SIZE) {
                List<String> chunk = ordered.subList(from, Math.min(from + CHUNK_SIZE, ordered.size()));
                String sql = "SELECT " + keyColumn + ", " + valueColumn + " FROM " + quote(table)
                        + " WHERE " + keyColumn + " IN (" + placeholders(chunk.size()) + ")";
                try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                    for (int i = 0; i < chunk.size(); i++) {
                        stmt.setString(i + 1, chunk.get(i));
                    }
                    try (ResultSet rs = stmt.executeQuery()) {
                        while (rs.next()) {
                            result.put(rs.getString(1), decode(rs.getString(2)));
                        }
                    }
                }
            }
            return null;
        });
        return result;
    }

    @Override
    public Map<String, Object> readAll(String table) {
        String sql = "SELECT " + keyColumn + ", " + valueColumn + " FROM " + quote(table);
        return broker.withLock(connection -> {
            Map<String, Object> result = new LinkedHashMap<>();
            try (PreparedStatement stmt = connection.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.put(rs.getString(1), decode(rs.getString(2)));
                }
            }
            return result;
        });
    }

    @Override
    public void write(String table, String key, Object value) {
        String payload = encode(value);
        String sql = dialect.upsert(table);
        broker.withLock(connection -> {
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                stmt.setString(1, key);
                stmt.setString(2, payload);
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public void writeAll(String table, Map<String, ?> values) {
        if (values.isEmpty()) {
            return;
        }
        // encode up front so a bad value fails before anything is written
        Map<String, String> payloads = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            payloads.put(Objects.requireNonNull(entry.getKey(), "key"), encode(entry.getValue()));
        }
        String sql = dialect.upsert(table);
        broker.withLock(connection -> inLocalTransaction(connection, () -> {
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                for (Map.Entry<String, String> entry : payloads.entrySet()) {
                    stmt.setString(1, entry.getKey());
                    stmt.setString(2, entry.getValue());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            return null;
        }));
    }

    @Override
    public boolean delete(String table, String key) {
        String sql = "DELETE FROM " + quote(table) + " WHERE " + keyColumn + " = ?";
        return broker.withLock(connection -> {
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                stmt.setString(1, key);
                return stmt.executeUpdate() > 0;
            }
        });
    }

    @Override
    public int deleteAll(String table, Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        List<String> ordered = new ArrayList<>(keys);
        return broker.withLock(connection -> inLocalTransaction(connection, () -> {
            int removed = 0;
            for (int from = 0; from < ordered.size(); from += CHUNK_SIZE) {
                List<String> chunk = ordered.subList(from, Math.min(from + CHUNK_SIZE, ordered.size()));
                String sql = "DELETE FROM " + quote(table) + " WHERE " + keyColumn + " IN (" + placeholders(chunk.size()) + ")";
                try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                    for (int i = 0; i < chunk.size(); i++) {
                        stmt.setString(i + 1, chunk.get(i));
                    }
                    removed += stmt.executeUpdate();
                }
            }
            return removed;
        }));
    }

    @Override
    public boolean exists(String table, String key) {
        String sql = "SELECT 1 FROM " + quote(table) + " WHERE " + keyColumn + " = ?";
        return broker.withLock(connection -> {
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                stmt.setString(1, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public List<String> keys(String table) {
        String sql = "SELECT " + keyColumn + " FROM " + quote(table);
        return broker.withLock(connection -> {
            List<String> keys = new ArrayList<>();
            try (PreparedStatement stmt = connection.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString(1));
                }
            }
            return Collections.unmodifiableList(keys);
        });
    }

    @Override
    public int count(String table) {
        String sql = "SELECT COUNT(*) FROM " + quote(table);
        return broker.withLock(connection -> {
            try (PreparedStatement stmt = connection.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    @Override
    public void clear(String table) {
        String sql = "DELETE FROM " + quote(table);
        broker.withLock(connection -> {
            try (Statement stmt = connection.createStatement()) {
                stmt.executeUpdate(sql);
            }
            return null;
        });
    }

    /**
     * Run {@code work} atomically: in its own engine transaction when none is active,
     * otherwise as part of the active one. Caller holds the broker mutex.
     */
    private <T> T inLocalTransaction(Connection connection, LocalWork<T> work) throws SQLException {
        if (broker.transactions().isActive()) {
            return work.run();
        }
        connection.setAutoCommit(false);
        T result;
        try {
            result = work.run();
            connection.commit();
        } catch (SQLException | RuntimeException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            try {
                connection.setAutoCommit(true);
            } catch (SQLException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
        connection.setAutoCommit(true);
        return result;
    }

    private String encode(Object value) {
        return encryptor.encrypt(codec.encode(value));
    }

    private Object decode(String payload) {
        if (payload == null) {
            return null;
        }
        return codec.decode(encryptor.decrypt(payload));
    }

    private String quote(String table) {
        return dialect.quoteIdentifier(table);
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    @FunctionalInterface
    private interface LocalWork<T> {
        T run() throws SQLException;
    }
}
