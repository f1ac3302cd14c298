package de.t14d3.drawer.core;

import de.t14d3.drawer.cache.CacheEntry;
import de.t14d3.drawer.cache.CachePolicy;
import de.t14d3.drawer.cache.CacheStore;
import de.t14d3.drawer.cache.CacheStrategy;
import de.t14d3.drawer.connection.ConnectionBroker;
import de.t14d3.drawer.connection.DatabaseTarget;
import de.t14d3.drawer.connection.SqlExecutor;
import de.t14d3.drawer.connection.TransactionCallback;
import de.t14d3.drawer.connection.TransactionManager;
import de.t14d3.drawer.connection.TransactionParticipant;
import de.t14d3.drawer.exceptions.ClosedException;
import de.t14d3.drawer.exceptions.TransactionException;
import de.t14d3.drawer.exceptions.ValidationException;
import de.t14d3.drawer.query.ClauseContext;
import de.t14d3.drawer.query.ClauseValidator;
import de.t14d3.drawer.query.Dialect;
import de.t14d3.drawer.query.Query;
import de.t14d3.drawer.query.QueryRequest;
import de.t14d3.drawer.serialization.ValueCodec;
import de.t14d3.drawer.storage.JdbcPersistenceBackend;
import de.t14d3.drawer.storage.PersistenceBackend;
import de.t14d3.drawer.storage.StoredValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Persistent key-value store bound to one table, with an in-memory cache in front of it.
 *
 * A root drawer owns its database connection. Drawers derived through {@link #table(String)}
 * share that connection, its mutex and its transaction state, but each has its own cache.
 * Once the root is closed every derived drawer fails with {@link ClosedException}.
 *
 * Writes go to storage first and then to the cache, both while holding the connection mutex.
 * Reads are answered from the cache when possible and read through to storage otherwise.
 */
public class Drawer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Drawer.class);

    private static final Set<String> CHECKPOINT_MODES = Set.of("PASSIVE", "FULL", "RESTART", "TRUNCATE");
    private static final Pattern PRAGMA_VALUE = Pattern.compile("[A-Za-z0-9_\\-]+");

    private final ConnectionBroker broker;
    private final PersistenceBackend backend;
    private final DrawerOptions options;
    private final String table;
    private final boolean ownsConnection;
    private final CacheStore cache;
    private final ClauseValidator validator;
    private final ValueCodec codec;
    private final TransactionParticipant participant = this::rolledBack;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    // every row of the table is cached, so a miss needs no storage round trip
    private volatile boolean fullyLoaded;

    protected Drawer(ConnectionBroker broker, PersistenceBackend backend, DrawerOptions options, boolean ownsConnection) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.options = Objects.requireNonNull(options, "options");
        this.table = options.tableName();
        this.ownsConnection = ownsConnection;
        this.cache = new CacheStore(options.cachePolicy(), options.clock(), this::expired);
        this.validator = options.clauseValidator();
        this.codec = options.valueCodec();

        backend.ensureTable(table);
        if (options.bulkPreload()) {
            loadAll();
        }
    }

    /**
     * Open a drawer with default options.
     *
     * @param target filesystem path, {@code sqlite:///} or {@code file:} URL, or JDBC URL
     */
    public static Drawer open(String target) {
        return open(target, DrawerOptions.defaults());
    }

    public static Drawer open(String target, DrawerOptions options) {
        DatabaseTarget resolved = DatabaseTarget.resolve(target);
        ConnectionBroker broker = ConnectionBroker.open(resolved.jdbcUrl(), options.engineSettings());
        try {
            Drawer drawer = create(broker, new JdbcPersistenceBackend(broker, options.valueCodec(), options.valueEncryptor()), options);
            logger.info("Opened drawer on {} (table '{}', cache {})", resolved, options.tableName(), options.cachePolicy());
            return drawer;
        } catch (RuntimeException e) {
            try {
                broker.close();
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * Assemble a root drawer from an open broker and a backend. The drawer takes ownership of the broker.
     */
    public static Drawer create(ConnectionBroker broker, PersistenceBackend backend, DrawerOptions options) {
        return new Drawer(broker, backend, options, true);
    }

    /**
     * Derive a drawer for another table on the same connection. It inherits this drawer's cache
     * and validation settings but gets a cache of its own.
     * <p>
     * Table names are case-sensitive on SQLite. H2 folds them to upper case, so there
     * {@code table("Users")} and {@code table("users")} read and write the same rows.
     *
     * @throws ClosedException     if this drawer is closed
     * @throws ValidationException if {@code name} is not a plain identifier
     */
    public Drawer table(String name) {
        checkOpen();
        ClauseValidator.validateIdentifier(name, "table name");
        DrawerOptions childOptions = options.toBuilder().tableName(name).bulkPreload(false).build();
        Drawer child = new Drawer(broker, backend, childOptions, false);
        logger.debug("Derived drawer for table '{}' from '{}'", name, table);
        return child;
    }

    // ==================== Map-like surface ====================

    /**
     * @throws NoSuchElementException if the key is not stored
     */
    public Object get(String key) {
        Optional<StoredValue> found = find(key);
        if (found.isEmpty()) {
            throw new NoSuchElementException("Key not found: '" + key + "'");
        }
        return found.get().value();
    }

    public Object get(String key, Object defaultValue) {
        Optional<StoredValue> found = find(key);
        return found.isPresent() ? found.get().value() : defaultValue;
    }

    public void put(String key, Object value) {
        checkOpen();
        requireKey(key);
        broker.withLock(connection -> {
            backend.write(table, key, value);
            cache.put(key, value);
            transactions().enlist(participant, key);
            return null;
        });
    }

    /**
     * @throws NoSuchElementException if the key is not stored
     */
    public void remove(String key) {
        checkOpen();
        requireKey(key);
        boolean removed = broker.withLock(connection -> {
            boolean deleted = backend.delete(table, key);
            cache.remove(key);
            transactions().enlist(participant, key);
            return deleted;
        });
        if (!removed) {
            throw new NoSuchElementException("Key not found: '" + key + "'");
        }
    }

    /**
     * Remove the key and return the value it had.
     *
     * @throws NoSuchElementException if the key is not stored
     */
    public Object pop(String key) {
        Optional<StoredValue> popped = popInternal(key);
        if (popped.isEmpty()) {
            throw new NoSuchElementException("Key not found: '" + key + "'");
        }
        return popped.get().value();
    }

    public Object pop(String key, Object defaultValue) {
        Optional<StoredValue> popped = popInternal(key);
        return popped.isPresent() ? popped.get().value() : defaultValue;
    }

    /**
     * A cache miss asks storage for the row without loading its value.
     */
    public boolean containsKey(String key) {
        checkOpen();
        requireKey(key);
        if (cache.lookup(key) != null) {
            return true;
        }
        if (missIsAuthoritative()) {
            return false;
        }
        return broker.withLock(connection -> cache.lookup(key) != null || backend.exists(table, key));
    }

    /**
     * Values of the requested keys that are stored, in request order; missing keys are left out.
     * Cache misses are read from storage in one round trip.
     */
    public Map<String, Object> getAll(Collection<String> keys) {
        checkOpen();
        Objects.requireNonNull(keys, "keys");
        keys.forEach(Drawer::requireKey);
        Map<String, Object> hits = new LinkedHashMap<>();
        List<String> misses = new ArrayList<>();
        for (String key : keys) {
            CacheEntry hit = cache.lookup(key);
            if (hit != null) {
                hits.put(key, hit.value());
            } else {
                misses.add(key);
            }
        }
        if (misses.isEmpty() || missIsAuthoritative()) {
            return hits;
        }
        Map<String, Object> stored = broker.withLock(connection -> {
            Map<String, Object> rows = backend.readMany(table, misses);
            for (Map.Entry<String, Object> entry : rows.entrySet()) {
                cache.put(entry.getKey(), entry.getValue());
                transactions().enlist(participant, entry.getKey());
            }
            return rows;
        });
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keys) {
            if (hits.containsKey(key)) {
                result.put(key, hits.get(key));
            } else if (stored.containsKey(key)) {
                result.put(key, stored.get(key));
            }
        }
        return result;
    }

    /**
     * Number of stored rows, counted in storage.
     */
    public int size() {
        checkOpen();
        return backend.count(table);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * All stored keys, read from storage.
     */
    public List<String> keys() {
        checkOpen();
        return backend.keys(table);
    }

    public List<Object> values() {
        checkOpen();
        return new ArrayList<>(loadAllEntries().values());
    }

    public List<Map.Entry<String, Object>> entries() {
        checkOpen();
        return new ArrayList<>(new LinkedHashMap<>(loadAllEntries()).entrySet());
    }

    /**
     * Same as {@link #batchUpdate(Map)}.
     */
    public void putAll(Map<String, ?> values) {
        batchUpdate(values);
    }

    /**
     * Store {@code value} unless the key already exists.
     *
     * @return the value now associated with the key: the existing one, or {@code value}
     */
    public Object putIfAbsent(String key, Object value) {
        checkOpen();
        requireKey(key);
        return broker.withLock(connection -> {
            Optional<StoredValue> existing = readThrough(key);
            if (existing.isPresent()) {
                return existing.get().value();
            }
            backend.write(table, key, value);
            cache.put(key, value);
            transactions().enlist(participant, key);
            return value;
        });
    }

    /**
     * Delete every row of the table and empty the cache.
     */
    public void clear() {
        checkOpen();
        broker.withLock(connection -> {
            backend.clear(table);
            cache.clear();
            fullyLoaded = false;
            transactions().enlist(participant);
            return null;
        });
    }

    /**
     * Copy of every stored entry, loading the whole table into the cache.
     */
    public Map<String, Object> toMap() {
        checkOpen();
        return new LinkedHashMap<>(loadAllEntries());
    }

    /**
     * Same as {@link #toMap()}.
     */
    public Map<String, Object> copy() {
        return toMap();
    }

    // ==================== Cache control and bulk operations ====================

    /**
     * Load every row of the table into the cache. With an unbounded cache, later misses are
     * answered without a storage round trip until the next {@link #refresh()}.
     */
    public void loadAll() {
        checkOpen();
        loadAllEntries();
    }

    /**
     * Drop the whole cache. Needed after writes that bypassed this drawer.
     */
    public void refresh() {
        checkOpen();
        broker.withLock(connection -> {
            cache.clear();
            fullyLoaded = false;
            return null;
        });
    }

    /**
     * Re-read one key from storage into the cache.
     */
    public void refresh(String key) {
        checkOpen();
        requireKey(key);
        broker.withLock(connection -> {
            cache.remove(key);
            return readThrough(key);
        });
    }

    public boolean isCached(String key) {
        checkOpen();
        requireKey(key);
        return cache.contains(key);
    }

    /**
     * Read the key from storage, bypassing and then updating the cache.
     *
     * @throws NoSuchElementException if the key is not stored
     */
    public Object getFresh(String key) {
        Optional<StoredValue> found = readFresh(key);
        if (found.isEmpty()) {
            throw new NoSuchElementException("Key not found: '" + key + "'");
        }
        return found.get().value();
    }

    public Object getFresh(String key, Object defaultValue) {
        Optional<StoredValue> found = readFresh(key);
        return found.isPresent() ? found.get().value() : defaultValue;
    }

    /**
     * Write all entries atomically, in one engine transaction unless a transaction is already active.
     */
    public void batchUpdate(Map<String, ?> values) {
        checkOpen();
        Objects.requireNonNull(values, "values");
        values.keySet().forEach(Drawer::requireKey);
        broker.withLock(connection -> {
            backend.writeAll(table, values);
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                cache.put(entry.getKey(), entry.getValue());
                transactions().enlist(participant, entry.getKey());
            }
            return null;
        });
    }

    /**
     * Delete all keys atomically. Missing keys are ignored.
     *
     * @return number of rows removed
     */
    public int batchDelete(Collection<String> keys) {
        checkOpen();
        Objects.requireNonNull(keys, "keys");
        keys.forEach(Drawer::requireKey);
        return broker.withLock(connection -> {
            int removed = backend.deleteAll(table, keys);
            cache.removeAll(keys);
            for (String key : keys) {
                transactions().enlist(participant, key);
            }
            return removed;
        });
    }

    /**
     * Apply the cache eviction rule eagerly. Expired TTL entries are otherwise removed when next read.
     *
     * @return number of cache entries removed
     */
    public int sweepExpired() {
        checkOpen();
        return cache.evictIfNeeded();
    }

    /**
     * Keys currently held in this drawer's cache.
     */
    public Set<String> cachedKeys() {
        checkOpen();
        return cache.keys();
    }

    // ==================== Models ====================

    /**
     * Store a structured model object, converted to plain data by the value codec.
     */
    public void putModel(String key, Object model) {
        Objects.requireNonNull(model, "model");
        put(key, codec.fromModel(model));
    }

    /**
     * @throws NoSuchElementException if the key is not stored
     */
    public <T> T getModel(String key, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return codec.toModel(get(key), type);
    }

    // ==================== Raw SQL ====================

    /**
     * Run any statement on the writer connection. Changes made this way bypass the cache, so
     * cached entries of affected keys stay stale until {@link #refresh()}.
     *
     * @return result rows when the statement produced any, otherwise an empty list
     */
    public List<List<Object>> execute(String sql, Object... params) {
        checkOpen();
        Objects.requireNonNull(sql, "sql");
        return broker.withLock(connection -> {
            fullyLoaded = false;
            return SqlExecutor.execute(connection, sql, parameters(params));
        });
    }

    /**
     * Run a query on the writer connection and return its first row, or {@code null} if it has none.
     */
    public List<Object> fetchOne(String sql, Object... params) {
        List<List<Object>> rows = fetchAll(sql, params);
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Run a query on the writer connection. Statements that are not queries are rejected by the engine.
     */
    public List<List<Object>> fetchAll(String sql, Object... params) {
        checkOpen();
        Objects.requireNonNull(sql, "sql");
        return broker.withLock(connection -> SqlExecutor.queryRows(connection, sql, parameters(params)));
    }

    /**
     * Validate and run a SELECT described by {@code request}.
     *
     * @throws ValidationException if a fragment of the request is rejected; nothing is executed then
     */
    public List<Map<String, Object>> query(QueryRequest request) {
        checkOpen();
        Query query = prepareQuery(request);
        return broker.withLock(connection -> SqlExecutor.queryMaps(connection, query.getSql(), query.getParameters()));
    }

    /**
     * Validate every fragment of {@code request} and build the statement without running it.
     * The table defaults to this drawer's table.
     *
     * @throws ValidationException if a fragment is rejected
     */
    public Query prepareQuery(QueryRequest request) {
        Objects.requireNonNull(request, "request");
        String target = request.table() == null ? table : ClauseValidator.validateIdentifier(request.table(), "table name");
        for (String column : request.columns()) {
            if (!"*".equals(column.trim())) {
                validate(request, column, ClauseContext.COLUMNS);
            }
        }
        validate(request, request.where(), ClauseContext.WHERE);
        validate(request, request.groupBy(), ClauseContext.GROUP_BY);
        validate(request, request.orderBy(), ClauseContext.ORDER_BY);

        return Query.select(dialect(), request.columns().toArray(new String[0]))
                .from(target)
                .where(request.where(), request.parameters())
                .groupBy(request.groupBy())
                .orderBy(request.orderBy())
                .limit(request.limit())
                .offset(request.offset())
                .build();
    }

    // ==================== Engine housekeeping ====================

    /**
     * Read a SQLite pragma.
     *
     * @return first column of the first result row, or {@code null}
     */
    public Object pragma(String name) {
        checkOpen();
        requirePragmas("pragma");
        ClauseValidator.validateIdentifier(name, "pragma name");
        return broker.withLock(connection -> firstValue(SqlExecutor.execute(connection, "PRAGMA " + name, List.of())));
    }

    /**
     * Set a SQLite pragma.
     *
     * @param value a number or a bare word such as {@code WAL}
     * @return first column of the first result row, or {@code null}
     */
    public Object pragma(String name, Object value) {
        checkOpen();
        requirePragmas("pragma");
        ClauseValidator.validateIdentifier(name, "pragma name");
        Objects.requireNonNull(value, "value");
        String literal = value.toString();
        if (!(value instanceof Number) && !PRAGMA_VALUE.matcher(literal).matches()) {
            throw new ValidationException("Invalid value for pragma " + name + ": '" + literal + "'");
        }
        return broker.withLock(connection -> {
            fullyLoaded = false;
            return firstValue(SqlExecutor.execute(connection, "PRAGMA " + name + " = " + literal, List.of()));
        });
    }

    public int[] checkpoint() {
        return checkpoint("PASSIVE");
    }

    /**
     * Run a WAL checkpoint.
     *
     * @param mode PASSIVE, FULL, RESTART or TRUNCATE
     * @return {@code [busy, wal frames, checkpointed frames]} as reported by SQLite
     */
    public int[] checkpoint(String mode) {
        checkOpen();
        requirePragmas("checkpoint");
        Objects.requireNonNull(mode, "mode");
        String upper = mode.trim().toUpperCase(Locale.ROOT);
        if (!CHECKPOINT_MODES.contains(upper)) {
            throw new ValidationException("Invalid checkpoint mode: '" + mode + "' (expected one of " + CHECKPOINT_MODES + ")");
        }
        return broker.withLock(connection -> {
            List<List<Object>> rows = SqlExecutor.execute(connection, "PRAGMA wal_checkpoint(" + upper + ")", List.of());
            int[] result = new int[3];
            if (!rows.isEmpty()) {
                List<Object> row = rows.get(0);
                for (int i = 0; i < result.length && i < row.size(); i++) {
                    result[i] = row.get(i) instanceof Number n ? n.intValue() : 0;
                }
            }
            return result;
        });
    }

    /**
     * Rebuild the database file to reclaim free pages.
     *
     * @throws TransactionException if a transaction is active
     */
    public void vacuum() {
        checkOpen();
        requirePragmas("vacuum");
        broker.withLock(connection -> {
            if (transactions().isActive()) {
                throw new TransactionException("Cannot VACUUM while a transaction is active");
            }
            SqlExecutor.execute(connection, "VACUUM", List.of());
            return null;
        });
    }

    // ==================== Transactions ====================

    /**
     * Begin a transaction on the shared connection. It is visible to every drawer on that connection.
     *
     * @throws TransactionException if a transaction is already active
     */
    public void beginTransaction() {
        checkOpen();
        transactions().begin();
    }

    /**
     * @throws TransactionException if no transaction is active
     */
    public void commit() {
        checkOpen();
        transactions().commit();
    }

    /**
     * Roll back the active transaction. Keys written during it are dropped from the caches of
     * the drawers that wrote them.
     *
     * @throws TransactionException if no transaction is active
     */
    public void rollback() {
        checkOpen();
        transactions().rollback();
    }

    public boolean isTransactionActive() {
        return transactions().isActive();
    }

    /**
     * Run {@code work} in a transaction holding the connection mutex throughout. Commits when
     * the work returns; rolls back and rethrows the original failure when it throws.
     */
    public <T, X extends Exception> T inTransaction(TransactionCallback<T, X> work) throws X {
        checkOpen();
        Objects.requireNonNull(work, "work");
        return transactions().execute(work);
    }

    public void transactional(Runnable work) {
        Objects.requireNonNull(work, "work");
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    // ==================== Lifecycle ====================

    /**
     * Close this drawer. A root drawer also releases the connection, which closes every drawer
     * derived from it. Closing twice is a no-op.
     *
     * @throws TransactionException if this is the root and a transaction is active; nothing is closed then
     */
    @Override
    public void close() {
        if (closed.get()) {
            return;
        }
        if (ownsConnection) {
            broker.close();
        }
        if (closed.compareAndSet(false, true)) {
            cache.clear();
            logger.debug("Closed drawer for table '{}'", table);
        }
    }

    /**
     * @throws ClosedException if this drawer or the connection it uses has been closed
     */
    public void checkOpen() {
        if (closed.get()) {
            throw new ClosedException("Drawer is closed (table: '" + table + "')");
        }
        if (broker.isClosed()) {
            throw new ClosedException("Parent database connection is closed (table: '" + table + "')");
        }
    }

    public boolean isClosed() {
        return closed.get() || broker.isClosed();
    }

    public boolean isRoot() {
        return ownsConnection;
    }

    public String tableName() {
        return table;
    }

    public DrawerOptions options() {
        return options;
    }

    public CachePolicy cachePolicy() {
        return cache.policy();
    }

    public String jdbcUrl() {
        return broker.jdbcUrl();
    }

    public Dialect dialect() {
        return broker.dialect();
    }

    @Override
    public String toString() {
        return "Drawer(" + broker.jdbcUrl() + ", table='" + table + "', cached=" + cache.size() + ")";
    }

    // ==================== Internals ====================

    private Optional<StoredValue> find(String key) {
        checkOpen();
        requireKey(key);
        CacheEntry hit = cache.lookup(key);
        if (hit != null) {
            return Optional.of(new StoredValue(hit.value()));
        }
        if (missIsAuthoritative()) {
            return Optional.empty();
        }
        return broker.withLock(connection -> readThrough(key));
    }

    // caller holds the broker mutex
    private Optional<StoredValue> readThrough(String key) {
        CacheEntry hit = cache.lookup(key);
        if (hit != null) {
            return Optional.of(new StoredValue(hit.value()));
        }
        Optional<StoredValue> stored = backend.read(table, key);
        if (stored.isPresent()) {
            cache.put(key, stored.get().value());
            transactions().enlist(participant, key);
        }
        return stored;
    }

    private Optional<StoredValue> readFresh(String key) {
        checkOpen();
        requireKey(key);
        return broker.withLock(connection -> {
            cache.remove(key);
            return readThrough(key);
        });
    }

    private Optional<StoredValue> popInternal(String key) {
        checkOpen();
        requireKey(key);
        return broker.withLock(connection -> {
            Optional<StoredValue> existing = missIsAuthoritative() && cache.lookup(key) == null
                    ? Optional.empty()
                    : readThrough(key);
            if (existing.isPresent()) {
                backend.delete(table, key);
                cache.remove(key);
                transactions().enlist(participant, key);
            }
            return existing;
        });
    }

    private Map<String, Object> loadAllEntries() {
        if (missIsAuthoritative()) {
            return cache.snapshot();
        }
        return broker.withLock(connection -> {
            Map<String, Object> all = backend.readAll(table);
            for (Map.Entry<String, Object> entry : all.entrySet()) {
                cache.put(entry.getKey(), entry.getValue());
                transactions().enlist(participant, entry.getKey());
            }
            transactions().enlist(participant);
            fullyLoaded = true;
            return all;
        });
    }

    private boolean missIsAuthoritative() {
        return fullyLoaded && cache.policy().strategy() == CacheStrategy.UNBOUNDED;
    }

    private void rolledBack(Set<String> keys) {
        cache.removeAll(keys);
        fullyLoaded = false;
        logger.debug("Dropped {} cached keys of table '{}' after rollback", keys.size(), table);
    }

    private void expired(String key) {
        logger.debug("Cached key '{}' of table '{}' expired; deleting stored row", key, table);
        backend.delete(table, key);
    }

    private void validate(QueryRequest request, String fragment, ClauseContext context) {
        validator.validate(fragment, context, request.allowedFunctions(), request.forbiddenFunctions(),
                request.overrideAllowed());
    }

    private void requirePragmas(String operation) {
        if (!dialect().supportsPragmas()) {
            throw new UnsupportedOperationException(operation + " is only supported on SQLite, not " + dialect());
        }
    }

    private TransactionManager transactions() {
        return broker.transactions();
    }

    private static Object firstValue(List<List<Object>> rows) {
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            return null;
        }
        return rows.get(0).get(0);
    }

    private static List<Object> parameters(Object[] params) {
        return params == null ? List.of() : Arrays.asList(params);
    }

    private static void requireKey(String key) {
        Objects.requireNonNull(key, "key");
    }
}
