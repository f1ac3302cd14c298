package de.t14d3.drawer.async;

import de.t14d3.drawer.connection.DatabaseTarget;
import de.t14d3.drawer.connection.ReadConnectionPool;
import de.t14d3.drawer.connection.SqlExecutor;
import de.t14d3.drawer.connection.TransactionCallback;
import de.t14d3.drawer.core.Drawer;
import de.t14d3.drawer.core.DrawerOptions;
import de.t14d3.drawer.exceptions.ClosedException;
import de.t14d3.drawer.exceptions.DatabaseException;
import de.t14d3.drawer.exceptions.TransactionException;
import de.t14d3.drawer.query.Query;
import de.t14d3.drawer.query.QueryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Asynchronous counterpart of {@link Drawer}: every operation is dispatched onto a fixed pool
 * of worker threads and answered through a {@link CompletableFuture}.
 *
 * <p>With a read pool configured ({@link DrawerOptions#readPoolSize()} &gt; 0), {@code fetchOne},
 * {@code fetchAll} and {@code query} run on dedicated read-only connections without taking the
 * writer mutex. Those reads never see uncommitted writes and carry no ordering guarantee
 * relative to concurrent writes.
 *
 * <p>Cancelling a returned future does not interrupt work that has already been dispatched.
 * Failures complete the future exceptionally with the same exception type the synchronous
 * call would have thrown, wrapped in a {@link CompletionException}.
 */
public class AsyncDrawer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AsyncDrawer.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final Drawer drawer;
    private final ExecutorService executor;
    private final ReadConnectionPool readPool;
    private final InFlight inFlight;
    private final boolean ownsResources;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object closeLock = new Object();

    /**
     * Wrap a drawer, creating the worker pool and the optional read pool from its options.
     * Closing the async drawer closes the wrapped one.
     */
    public AsyncDrawer(Drawer drawer) {
        this.drawer = Objects.requireNonNull(drawer, "drawer");
        DrawerOptions options = drawer.options();
        this.executor = newWorkerPool(options.workerCount(), options.threadNamePrefix());
        ReadConnectionPool pool = null;
        try {
            pool = openReadPool(drawer, options);
        } catch (RuntimeException e) {
            executor.shutdownNow();
            throw e;
        }
        this.readPool = pool;
        this.inFlight = new InFlight();
        this.ownsResources = true;
        logger.debug("Started {} workers for table '{}' (read pool: {})", options.workerCount(), drawer.tableName(),
                pool == null ? "disabled" : pool.size() + " connections");
    }

    private AsyncDrawer(Drawer drawer, ExecutorService executor, ReadConnectionPool readPool, InFlight inFlight) {
        this.drawer = drawer;
        this.executor = executor;
        this.readPool = readPool;
        this.inFlight = inFlight;
        this.ownsResources = false;
    }

    public static AsyncDrawer open(String target) {
        return open(target, DrawerOptions.defaults());
    }

    public static AsyncDrawer open(String target, DrawerOptions options) {
        Drawer drawer = Drawer.open(target, options);
        try {
            return new AsyncDrawer(drawer);
        } catch (RuntimeException e) {
            try {
                drawer.close();
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * Derive an async drawer for another table. It shares this drawer's worker pool and read pool;
     * closing it does not shut them down.
     */
    public AsyncDrawer table(String name) {
        checkNotClosed();
        return new AsyncDrawer(drawer.table(name), executor, readPool, inFlight);
    }

    /**
     * The wrapped synchronous drawer.
     */
    public Drawer drawer() {
        return drawer;
    }

    public boolean hasReadPool() {
        return readPool != null;
    }

    public boolean isClosed() {
        return closed.get() || drawer.isClosed();
    }

    // ==================== Map-like surface ====================

    public CompletableFuture<Object> get(String key) {
        return supply(() -> drawer.get(key));
    }

    public CompletableFuture<Object> get(String key, Object defaultValue) {
        return supply(() -> drawer.get(key, defaultValue));
    }

    public CompletableFuture<Void> put(String key, Object value) {
        return run(() -> drawer.put(key, value));
    }

    public CompletableFuture<Void> remove(String key) {
        return run(() -> drawer.remove(key));
    }

    public CompletableFuture<Object> pop(String key) {
        return supply(() -> drawer.pop(key));
    }

    public CompletableFuture<Object> pop(String key, Object defaultValue) {
        return supply(() -> drawer.pop(key, defaultValue));
    }

    public CompletableFuture<Boolean> containsKey(String key) {
        return supply(() -> drawer.containsKey(key));
    }

    public CompletableFuture<Map<String, Object>> getAll(Collection<String> keys) {
        return supply(() -> drawer.getAll(keys));
    }

    public CompletableFuture<Integer> size() {
        return supply(drawer::size);
    }

    public CompletableFuture<List<String>> keys() {
        return supply(drawer::keys);
    }

    public CompletableFuture<List<Object>> values() {
        return supply(drawer::values);
    }

    public CompletableFuture<List<Map.Entry<String, Object>>> entries() {
        return supply(drawer::entries);
    }

    public CompletableFuture<Void> putAll(Map<String, ?> values) {
        return run(() -> drawer.putAll(values));
    }

    public CompletableFuture<Object> putIfAbsent(String key, Object value) {
        return supply(() -> drawer.putIfAbsent(key, value));
    }

    public CompletableFuture<Void> clear() {
        return run(drawer::clear);
    }

    public CompletableFuture<Map<String, Object>> toMap() {
        return supply(drawer::toMap);
    }

    // ==================== Cache control and bulk operations ====================

    public CompletableFuture<Void> loadAll() {
        return run(drawer::loadAll);
    }

    public CompletableFuture<Void> refresh() {
        return run(drawer::refresh);
    }

    public CompletableFuture<Void> refresh(String key) {
        return run(() -> drawer.refresh(key));
    }

    public CompletableFuture<Boolean> isCached(String key) {
        return supply(() -> drawer.isCached(key));
    }

    public CompletableFuture<Object> getFresh(String key) {
        return supply(() -> drawer.getFresh(key));
    }

    public CompletableFuture<Object> getFresh(String key, Object defaultValue) {
        return supply(() -> drawer.getFresh(key, defaultValue));
    }

    public CompletableFuture<Void> batchUpdate(Map<String, ?> values) {
        return run(() -> drawer.batchUpdate(values));
    }

    public CompletableFuture<Integer> batchDelete(Collection<String> keys) {
        return supply(() -> drawer.batchDelete(keys));
    }

    public CompletableFuture<Integer> sweepExpired() {
        return supply(drawer::sweepExpired);
    }

    public CompletableFuture<Set<String>> cachedKeys() {
        return supply(drawer::cachedKeys);
    }

    // ==================== Models ====================

    public CompletableFuture<Void> putModel(String key, Object model) {
        return run(() -> drawer.putModel(key, model));
    }

    public <T> CompletableFuture<T> getModel(String key, Class<T> type) {
        return supply(() -> drawer.getModel(key, type));
    }

    // ==================== Raw SQL ====================

    /**
     * Always runs on the writer connection.
     */
    public CompletableFuture<List<List<Object>>> execute(String sql, Object... params) {
        return supply(() -> drawer.execute(sql, params));
    }

    public CompletableFuture<List<Object>> fetchOne(String sql, Object... params) {
        if (readPool == null) {
            return supply(() -> drawer.fetchOne(sql, params));
        }
        return supply(() -> {
            List<List<Object>> rows = readRows(sql, params);
            return rows.isEmpty() ? null : rows.get(0);
        });
    }

    public CompletableFuture<List<List<Object>>> fetchAll(String sql, Object... params) {
        if (readPool == null) {
            return supply(() -> drawer.fetchAll(sql, params));
        }
        return supply(() -> readRows(sql, params));
    }

    public CompletableFuture<List<Map<String, Object>>> query(QueryRequest request) {
        if (readPool == null) {
            return supply(() -> drawer.query(request));
        }
        return supply(() -> {
            drawer.checkOpen();
            Query query = drawer.prepareQuery(request);
            return readPool.withConnection(connection ->
                    SqlExecutor.queryMaps(connection, query.getSql(), query.getParameters()));
        });
    }

    // ==================== Engine housekeeping ====================

    public CompletableFuture<Object> pragma(String name) {
        return supply(() -> drawer.pragma(name));
    }

    public CompletableFuture<Object> pragma(String name, Object value) {
        return supply(() -> drawer.pragma(name, value));
    }

    public CompletableFuture<int[]> checkpoint(String mode) {
        return supply(() -> drawer.checkpoint(mode));
    }

    public CompletableFuture<Void> vacuum() {
        return run(drawer::vacuum);
    }

    // ==================== Transactions ====================

    public CompletableFuture<Void> beginTransaction() {
        return run(drawer::beginTransaction);
    }

    public CompletableFuture<Void> commit() {
        return run(drawer::commit);
    }

    public CompletableFuture<Void> rollback() {
        return run(drawer::rollback);
    }

    public CompletableFuture<Boolean> isTransactionActive() {
        return supply(drawer::isTransactionActive);
    }

    /**
     * Run a whole transaction on one worker thread. The work must use the synchronous
     * {@link #drawer()} API: waiting on another future of this drawer from inside it deadlocks.
     */
    public <T> CompletableFuture<T> inTransaction(TransactionCallback<T, ? extends Exception> work) {
        return supply(() -> {
            try {
                return drawer.inTransaction(work);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        });
    }

    // ==================== Lifecycle ====================

    /**
     * Wait for dispatched work to finish, close the wrapped drawer, then stop the workers and
     * close the read-only connections. Derived async drawers only close their own drawer.
     * <p>
     * The transaction check and the close of the root drawer happen together under the writer
     * mutex, after the queue has drained, so a {@code beginTransaction()} dispatched before this
     * call is seen.
     *
     * @throws TransactionException if the wrapped root drawer has an active transaction; nothing is closed then
     * @throws DatabaseException    if read-only connections failed to close; all of them were still attempted
     */
    @Override
    public void close() {
        if (closed.get()) {
            return;
        }
        if (!ownsResources) {
            if (closed.compareAndSet(false, true)) {
                drawer.close();
            }
            return;
        }
        synchronized (closeLock) {
            if (closed.get()) {
                return;
            }
            checkNoActiveTransaction();
            awaitDispatchedWork();

            RuntimeException failure = null;
            try {
                drawer.close();
            } catch (RuntimeException e) {
                // a rejected close (active transaction, lock timeout) leaves everything open
                if (!drawer.isClosed()) {
                    throw e;
                }
                failure = e;
            }
            closed.set(true);
            shutdownWorkers();

            if (readPool != null) {
                try {
                    readPool.close();
                } catch (DatabaseException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
        }
        logger.info("Async drawer for table '{}' closed", drawer.tableName());
    }

    private void checkNoActiveTransaction() {
        if (drawer.isRoot() && !drawer.isClosed() && drawer.isTransactionActive()) {
            throw new TransactionException("Cannot close connection while a transaction is active; commit or roll back first");
        }
    }

    private void awaitDispatchedWork() {
        try {
            if (!inFlight.awaitIdle(TimeUnit.SECONDS.toNanos(SHUTDOWN_TIMEOUT_SECONDS))) {
                logger.warn("{} dispatched tasks still running after {} s; closing anyway",
                        inFlight.count(), SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void shutdownWorkers() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Workers did not finish within {} s; interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private List<List<Object>> readRows(String sql, Object[] params) {
        drawer.checkOpen();
        Objects.requireNonNull(sql, "sql");
        List<Object> parameters = params == null ? List.of() : Arrays.asList(params);
        return readPool.withConnection(connection -> SqlExecutor.queryRows(connection, sql, parameters));
    }

    private <T> CompletableFuture<T> supply(Supplier<T> work) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(
                    new ClosedException("Async drawer is closed (table: '" + drawer.tableName() + "')"));
        }
        CompletableFuture<T> future = new CompletableFuture<>();
        inFlight.started();
        try {
            executor.execute(() -> {
                try {
                    // skipped when cancelled before a worker picked it up
                    if (!future.isDone()) {
                        future.complete(work.get());
                    }
                } catch (Throwable t) {
                    future.completeExceptionally(t instanceof CompletionException ? t : new CompletionException(t));
                } finally {
                    inFlight.finished();
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.finished();
            return CompletableFuture.failedFuture(
                    new ClosedException("Worker pool is shut down (table: '" + drawer.tableName() + "')"));
        }
        return future;
    }

    private CompletableFuture<Void> run(Runnable work) {
        return supply(() -> {
            work.run();
            return null;
        });
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new ClosedException("Async drawer is closed (table: '" + drawer.tableName() + "')");
        }
    }

    private static ExecutorService newWorkerPool(int workers, String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, namePrefix + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(workers, factory);
    }

    private static ReadConnectionPool openReadPool(Drawer drawer, DrawerOptions options) {
        if (options.readPoolSize() <= 0) {
            return null;
        }
        if (DatabaseTarget.resolve(drawer.jdbcUrl()).inMemory()) {
            throw new IllegalArgumentException("A read pool needs a file database; "
                    + drawer.jdbcUrl() + " is private to its connection");
        }
        return ReadConnectionPool.open(drawer.jdbcUrl(), drawer.dialect(), options.readPoolSize(), options.busyTimeout());
    }

    /**
     * Dispatched tasks that have not finished yet, shared with the async drawers derived from this one.
     */
    private static final class InFlight {
        private int count;

        synchronized void started() {
            count++;
        }

        synchronized void finished() {
            if (--count == 0) {
                notifyAll();
            }
        }

        synchronized int count() {
            return count;
        }

        synchronized boolean awaitIdle(long timeoutNanos) throws InterruptedException {
            long deadline = System.nanoTime() + timeoutNanos;
            while (count > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(this, remaining);
            }
            return true;
        }
    }
}
