package de.t14d3.drawer.connection;

import de.t14d3.drawer.exceptions.ClosedException;
import de.t14d3.drawer.exceptions.DatabaseException;
import de.t14d3.drawer.exceptions.LockException;
import de.t14d3.drawer.query.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed set of read-only connections opened against the same store as a writer connection.
 *
 * Work borrowed from the pool never takes the broker mutex and never joins a transaction,
 * so it carries no ordering guarantee relative to concurrent writes.
 */
public final class ReadConnectionPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ReadConnectionPool.class);

    private final List<Connection> connections;
    private final BlockingQueue<Connection> idle;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ReadConnectionPool(List<Connection> connections) {
        Objects.requireNonNull(connections, "connections");
        if (connections.isEmpty()) {
            throw new IllegalArgumentException("Read pool needs at least one connection");
        }
        this.connections = List.copyOf(connections);
        this.idle = new ArrayBlockingQueue<>(connections.size(), false, connections);
    }

    /**
     * Open {@code size} read-only connections to {@code jdbcUrl}. Connections opened before a
     * failure are closed again.
     */
    public static ReadConnectionPool open(String jdbcUrl, Dialect dialect, int size, Duration busyTimeout) {
        if (size <= 0) {
            throw new IllegalArgumentException("Read pool size must be > 0, got " + size);
        }
        List<Connection> opened = new ArrayList<>(size);
        try {
            for (int i = 0; i < size; i++) {
                opened.add(dialect.openReadOnly(jdbcUrl, busyTimeout));
            }
        } catch (SQLException e) {
            DatabaseException failure = new DatabaseException("Failed to open read-only connection to " + jdbcUrl, e);
            for (Connection connection : opened) {
                try {
                    connection.close();
                } catch (SQLException closeFailure) {
                    failure.addSuppressed(closeFailure);
                }
            }
            throw failure;
        }
        logger.debug("Opened {} read-only connections to {}", size, jdbcUrl);
        return new ReadConnectionPool(opened);
    }

    public int size() {
        return connections.size();
    }

    public int available() {
        return idle.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Borrow a connection for the duration of {@code work}, waiting while all are in use.
     */
    public <T> T withConnection(SqlWork<T> work) {
        if (closed.get()) {
            throw new ClosedException("Read pool is closed");
        }
        Connection connection;
        try {
            connection = idle.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockException("Interrupted while waiting for a read connection", e);
        }
        try {
            if (closed.get()) {
                throw new ClosedException("Read pool is closed");
            }
            return work.run(connection);
        } catch (SQLException e) {
            throw new DatabaseException("Read operation failed", e);
        } finally {
            idle.offer(connection);
        }
    }

    /**
     * Close every connection. A failure on one does not stop the others from being closed;
     * all failures are rethrown together afterwards.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<SQLException> failures = new ArrayList<>();
        for (Connection connection : connections) {
            try {
                connection.close();
            } catch (SQLException e) {
                logger.warn("Failed to close read-only connection", e);
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            DatabaseException error = new DatabaseException(
                    "Failed to close " + failures.size() + " of " + connections.size() + " read-only connections");
            failures.forEach(error::addSuppressed);
            throw error;
        }
        logger.debug("Closed {} read-only connections", connections.size());
    }
}
