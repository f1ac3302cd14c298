package de.t14d3.drawer.connection;

import de.t14d3.drawer.exceptions.ClosedException;
import de.t14d3.drawer.exceptions.DatabaseException;
import de.t14d3.drawer.exceptions.LockException;
import de.t14d3.drawer.exceptions.TransactionException;
import de.t14d3.drawer.query.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single writer connection of a root drawer and the re-entrant mutex serializing access to it.
 *
 * The broker is shared by reference between a root drawer and every drawer derived from it.
 * Its closed flag is the signal children observe once the root has been closed.
 */
public final class ConnectionBroker {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionBroker.class);

    private final String jdbcUrl;
    private final Dialect dialect;
    private final Connection connection;
    private final Duration lockTimeout;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final TransactionManager transactions;

    public ConnectionBroker(String jdbcUrl, Dialect dialect, Connection connection, Duration lockTimeout) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.lockTimeout = lockTimeout;
        this.transactions = new TransactionManager(this);
    }

    /**
     * Open the writer connection for {@code jdbcUrl} and apply the engine settings.
     */
    public static ConnectionBroker open(String jdbcUrl, EngineSettings settings) {
        Dialect dialect = Dialect.detectFromUrl(jdbcUrl);
        Connection connection;
        try {
            connection = DriverManager.getConnection(jdbcUrl);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to open connection to " + jdbcUrl, e);
        }
        try {
            applySettings(connection, dialect, settings);
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new DatabaseException("Failed to configure connection to " + jdbcUrl, e);
        }
        logger.debug("Opened {} connection to {}", dialect, jdbcUrl);
        return new ConnectionBroker(jdbcUrl, dialect, connection, settings.lockTimeout());
    }

    private static void applySettings(Connection connection, Dialect dialect, EngineSettings settings) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            if (dialect == Dialect.SQLITE) {
                if (settings.optimize()) {
                    stmt.execute("PRAGMA journal_mode = WAL");
                    stmt.execute("PRAGMA synchronous = NORMAL");
                    stmt.execute("PRAGMA cache_size = -" + (settings.cacheSizeMb() * 1024));
                    stmt.execute("PRAGMA temp_store = MEMORY");
                }
                if (settings.busyTimeout() != null) {
                    stmt.execute("PRAGMA busy_timeout = " + settings.busyTimeout().toMillis());
                }
            } else if (dialect == Dialect.H2 && settings.busyTimeout() != null) {
                stmt.execute("SET LOCK_TIMEOUT " + settings.busyTimeout().toMillis());
            }
        }
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    public Dialect dialect() {
        return dialect;
    }

    public TransactionManager transactions() {
        return transactions;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Run JDBC work on the writer connection while holding the mutex.
     *
     * @throws ClosedException   if the connection has been released
     * @throws DatabaseException wrapping any {@link SQLException}
     * @throws LockException     if a lock timeout is configured and expires
     */
    public <T> T withLock(SqlWork<T> work) {
        acquire();
        try {
            ensureOpen();
            return work.run(connection);
        } catch (SQLException e) {
            throw new DatabaseException("Database operation failed on " + jdbcUrl, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release the writer connection. A no-op when already closed.
     *
     * @throws TransactionException if a transaction is active; nothing is changed in that case
     */
    public void close() {
        acquire();
        try {
            if (closed.get()) {
                return;
            }
            if (transactions.isActive()) {
                throw new TransactionException("Cannot close connection while a transaction is active; commit or roll back first");
            }
            closed.set(true);
            try {
                connection.close();
            } catch (SQLException e) {
                throw new DatabaseException("Failed to close connection to " + jdbcUrl, e);
            }
            logger.info("Closed connection to {}", jdbcUrl);
        } finally {
            lock.unlock();
        }
    }

    void release() {
        lock.unlock();
    }

    void acquire() {
        if (lockTimeout == null) {
            lock.lock();
            return;
        }
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LockException("Timed out after " + lockTimeout.toMillis() + " ms waiting for the connection lock on " + jdbcUrl);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockException("Interrupted while waiting for the connection lock on " + jdbcUrl, e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new ClosedException("Database connection is closed: " + jdbcUrl);
        }
    }
}
