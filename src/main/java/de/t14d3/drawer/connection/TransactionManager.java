package de.t14d3.drawer.connection;

import de.t14d3.drawer.exceptions.TransactionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Transaction state machine of one connection: {@code IDLE --begin--> ACTIVE --commit|rollback--> IDLE}.
 *
 * The state lives on the connection, so it is shared by every drawer using that connection.
 * All transitions run under the broker mutex. Misuse raises {@link TransactionException}
 * and leaves the state unchanged.
 */
public final class TransactionManager {
    private static final Logger logger = LoggerFactory.getLogger(TransactionManager.class);

    private final ConnectionBroker broker;
    private volatile TransactionState state = TransactionState.IDLE;
    // guarded by the broker mutex
    private final Map<TransactionParticipant, Set<String>> enlisted = new IdentityHashMap<>();

    TransactionManager(ConnectionBroker broker) {
        this.broker = broker;
    }

    public TransactionState state() {
        return state;
    }

    public boolean isActive() {
        return state == TransactionState.ACTIVE;
    }

    /**
     * Begin a new transaction.
     *
     * @throws TransactionException if a transaction is already active on this connection
     */
    public void begin() {
        broker.withLock(connection -> {
            if (state == TransactionState.ACTIVE) {
                throw new TransactionException("Transaction already active; nested transactions are not supported");
            }
            connection.setAutoCommit(false);
            enlisted.clear();
            state = TransactionState.ACTIVE;
            logger.debug("Transaction started on {}", broker.jdbcUrl());
            return null;
        });
    }

    /**
     * Commit the current transaction. If the engine rejects the commit the transaction stays active.
     *
     * @throws TransactionException if no transaction is active
     */
    public void commit() {
        broker.withLock(connection -> {
            if (state != TransactionState.ACTIVE) {
                throw new TransactionException("No active transaction to commit");
            }
            connection.commit();
            connection.setAutoCommit(true);
            enlisted.clear();
            state = TransactionState.IDLE;
            logger.debug("Transaction committed on {}", broker.jdbcUrl());
            return null;
        });
    }

    /**
     * Roll back the current transaction and drop every key written during it from the caches
     * that wrote them.
     *
     * @throws TransactionException if no transaction is active
     */
    public void rollback() {
        broker.withLock(connection -> {
            if (state != TransactionState.ACTIVE) {
                throw new TransactionException("No active transaction to rollback");
            }
            SQLException failure = null;
            try {
                connection.rollback();
            } catch (SQLException e) {
                failure = e;
            }
            failure = restoreAutoCommit(connection, failure);
            state = TransactionState.IDLE;
            notifyRolledBack();
            if (failure != null) {
                throw failure;
            }
            logger.debug("Transaction rolled back on {}", broker.jdbcUrl());
            return null;
        });
    }

    /**
     * Run {@code work} between begin and commit while holding the connection mutex for the whole
     * unit. If the work throws, the transaction is rolled back and the original failure is
     * rethrown unchanged (a rollback failure is attached as suppressed).
     *
     * Work must stay on the calling thread: waiting on another thread that needs this connection
     * would deadlock.
     */
    public <T, X extends Exception> T execute(TransactionCallback<T, X> work) throws X {
        broker.acquire();
        try {
            begin();
            try {
                T value = work.doInTransaction();
                commit();
                return value;
            } catch (Throwable t) {
                rollbackAfter(t);
                throw t;
            }
        } finally {
            broker.release();
        }
    }

    /**
     * Record that {@code participant} wrote {@code key} inside the active transaction.
     * Ignored when no transaction is active. Caller holds the broker mutex.
     */
    public void enlist(TransactionParticipant participant, String key) {
        if (state != TransactionState.ACTIVE) {
            return;
        }
        enlisted.computeIfAbsent(participant, p -> new LinkedHashSet<>()).add(key);
    }

    /**
     * Record that {@code participant} took part in the active transaction without writing a
     * specific key, for example by clearing or bulk-loading its namespace.
     */
    public void enlist(TransactionParticipant participant) {
        if (state != TransactionState.ACTIVE) {
            return;
        }
        enlisted.computeIfAbsent(participant, p -> new LinkedHashSet<>());
    }

    private void rollbackAfter(Throwable failure) {
        if (state != TransactionState.ACTIVE) {
            return;
        }
        try {
            rollback();
        } catch (RuntimeException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }

    private void notifyRolledBack() {
        Map<TransactionParticipant, Set<String>> snapshot = new IdentityHashMap<>(enlisted);
        enlisted.clear();
        for (Map.Entry<TransactionParticipant, Set<String>> entry : snapshot.entrySet()) {
            entry.getKey().rolledBack(entry.getValue());
        }
    }

    private static SQLException restoreAutoCommit(Connection connection, SQLException failure) {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            if (failure == null) {
                return e;
            }
            failure.addSuppressed(e);
        }
        return failure;
    }
}
