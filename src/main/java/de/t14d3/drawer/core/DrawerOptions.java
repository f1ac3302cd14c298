package de.t14d3.drawer.core;

import de.t14d3.drawer.cache.CachePolicy;
import de.t14d3.drawer.cache.CacheStrategy;
import de.t14d3.drawer.connection.EngineSettings;
import de.t14d3.drawer.query.ClauseValidator;
import de.t14d3.drawer.serialization.JacksonValueCodec;
import de.t14d3.drawer.serialization.ValueCodec;
import de.t14d3.drawer.serialization.ValueEncryptor;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Construction options of a root {@link Drawer}. Immutable; create through {@link #builder()}
 * or {@link #fromProperties(Properties)}.
 */
public final class DrawerOptions {
    public static final String DEFAULT_TABLE = "data";
    public static final int DEFAULT_WORKER_COUNT = 5;

    private final String tableName;
    private final boolean bulkPreload;
    private final CacheStrategy cacheStrategy;
    private final Integer cacheCapacity;
    private final Duration cacheTtl;
    private final boolean cacheCascadeDelete;
    private final int workerCount;
    private final String threadNamePrefix;
    private final int readPoolSize;
    private final boolean strictValidation;
    private final Set<String> allowedFunctions;
    private final Set<String> forbiddenFunctions;
    private final int maxClauseLength;
    private final boolean optimize;
    private final int cacheSizeMb;
    private final Duration busyTimeout;
    private final Duration lockTimeout;
    private final ValueCodec valueCodec;
    private final ValueEncryptor valueEncryptor;
    private final Clock clock;

    private DrawerOptions(Builder b) {
        this.tableName = b.tableName;
        this.bulkPreload = b.bulkPreload;
        this.cacheStrategy = b.cacheStrategy;
        this.cacheCapacity = b.cacheCapacity;
        this.cacheTtl = b.cacheTtl;
        this.cacheCascadeDelete = b.cacheCascadeDelete;
        this.workerCount = b.workerCount;
        this.threadNamePrefix = b.threadNamePrefix;
        this.readPoolSize = b.readPoolSize;
        this.strictValidation = b.strictValidation;
        this.allowedFunctions = Set.copyOf(b.allowedFunctions);
        this.forbiddenFunctions = Set.copyOf(b.forbiddenFunctions);
        this.maxClauseLength = b.maxClauseLength;
        this.optimize = b.optimize;
        this.cacheSizeMb = b.cacheSizeMb;
        this.busyTimeout = b.busyTimeout;
        this.lockTimeout = b.lockTimeout;
        this.valueCodec = b.valueCodec != null ? b.valueCodec : new JacksonValueCodec();
        this.valueEncryptor = b.valueEncryptor != null ? b.valueEncryptor : ValueEncryptor.NONE;
        this.clock = b.clock;
    }

    public static DrawerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read options from {@code drawer.*} keys. Absent keys keep their defaults.
     *
     * <pre>
     * drawer.table                          data
     * drawer.bulk-preload                   false
     * drawer.cache.strategy                 unbounded | lru | ttl
     * drawer.cache.capacity                 (lru)
     * drawer.cache.ttl                      PT30S or milliseconds
     * drawer.cache.cascade-delete           false
     * drawer.workers                        5
     * drawer.thread-name-prefix             drawer
     * drawer.read-pool-size                 0
     * drawer.validation.strict              true
     * drawer.validation.allowed-functions   comma separated
     * drawer.validation.forbidden-functions comma separated
     * drawer.validation.max-clause-length   1000
     * drawer.engine.optimize                true
     * drawer.engine.cache-size-mb           64
     * drawer.engine.busy-timeout            PT5S or milliseconds
     * drawer.lock-timeout                   PT5S or milliseconds
     * </pre>
     *
     * @throws IllegalArgumentException on a malformed value
     */
    public static DrawerOptions fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();
        String value;
        if ((value = prop(props, "drawer.table")) != null) b.tableName(value);
        if ((value = prop(props, "drawer.bulk-preload")) != null) b.bulkPreload(parseBoolean("drawer.bulk-preload", value));
        if ((value = prop(props, "drawer.cache.strategy")) != null) b.cacheStrategy(parseStrategy(value));
        if ((value = prop(props, "drawer.cache.capacity")) != null) b.cacheCapacity(parseInt("drawer.cache.capacity", value));
        if ((value = prop(props, "drawer.cache.ttl")) != null) b.cacheTtl(parseDuration("drawer.cache.ttl", value));
        if ((value = prop(props, "drawer.cache.cascade-delete")) != null) b.cacheCascadeDelete(parseBoolean("drawer.cache.cascade-delete", value));
        if ((value = prop(props, "drawer.workers")) != null) b.workerCount(parseInt("drawer.workers", value));
        if ((value = prop(props, "drawer.thread-name-prefix")) != null) b.threadNamePrefix(value);
        if ((value = prop(props, "drawer.read-pool-size")) != null) b.readPoolSize(parseInt("drawer.read-pool-size", value));
        if ((value = prop(props, "drawer.validation.strict")) != null) b.strictValidation(parseBoolean("drawer.validation.strict", value));
        if ((value = prop(props, "drawer.validation.allowed-functions")) != null) b.allowedFunctions(parseList(value));
        if ((value = prop(props, "drawer.validation.forbidden-functions")) != null) b.forbiddenFunctions(parseList(value));
        if ((value = prop(props, "drawer.validation.max-clause-length")) != null) b.maxClauseLength(parseInt("drawer.validation.max-clause-length", value));
        if ((value = prop(props, "drawer.engine.optimize")) != null) b.optimize(parseBoolean("drawer.engine.optimize", value));
        if ((value = prop(props, "drawer.engine.cache-size-mb")) != null) b.cacheSizeMb(parseInt("drawer.engine.cache-size-mb", value));
        if ((value = prop(props, "drawer.engine.busy-timeout")) != null) b.busyTimeout(parseDuration("drawer.engine.busy-timeout", value));
        if ((value = prop(props, "drawer.lock-timeout")) != null) b.lockTimeout(parseDuration("drawer.lock-timeout", value));
        return b.build();
    }

    public String tableName() {
        return tableName;
    }

    public boolean bulkPreload() {
        return bulkPreload;
    }

    public CacheStrategy cacheStrategy() {
        return cacheStrategy;
    }

    public Integer cacheCapacity() {
        return cacheCapacity;
    }

    public Duration cacheTtl() {
        return cacheTtl;
    }

    public boolean cacheCascadeDelete() {
        return cacheCascadeDelete;
    }

    public int workerCount() {
        return workerCount;
    }

    public String threadNamePrefix() {
        return threadNamePrefix;
    }

    public int readPoolSize() {
        return readPoolSize;
    }

    public boolean strictValidation() {
        return strictValidation;
    }

    public Set<String> allowedFunctions() {
        return allowedFunctions;
    }

    public Set<String> forbiddenFunctions() {
        return forbiddenFunctions;
    }

    public int maxClauseLength() {
        return maxClauseLength;
    }

    public boolean optimize() {
        return optimize;
    }

    public int cacheSizeMb() {
        return cacheSizeMb;
    }

    public Duration busyTimeout() {
        return busyTimeout;
    }

    public Duration lockTimeout() {
        return lockTimeout;
    }

    public ValueCodec valueCodec() {
        return valueCodec;
    }

    public ValueEncryptor valueEncryptor() {
        return valueEncryptor;
    }

    /**
     * Time source of cache access and expiry bookkeeping.
     */
    public Clock clock() {
        return clock;
    }

    public CachePolicy cachePolicy() {
        return CachePolicy.of(cacheStrategy, cacheCapacity, cacheTtl, cacheCascadeDelete);
    }

    public EngineSettings engineSettings() {
        return new EngineSettings(optimize, cacheSizeMb, busyTimeout, lockTimeout);
    }

    public ClauseValidator clauseValidator() {
        return new ClauseValidator(strictValidation, allowedFunctions, forbiddenFunctions, maxClauseLength);
    }

    public Builder toBuilder() {
        return builder()
                .tableName(tableName)
                .bulkPreload(bulkPreload)
                .cacheStrategy(cacheStrategy)
                .cacheCapacity(cacheCapacity)
                .cacheTtl(cacheTtl)
                .cacheCascadeDelete(cacheCascadeDelete)
                .workerCount(workerCount)
                .threadNamePrefix(threadNamePrefix)
                .readPoolSize(readPoolSize)
                .strictValidation(strictValidation)
                .allowedFunctions(allowedFunctions)
                .forbiddenFunctions(forbiddenFunctions)
                .maxClauseLength(maxClauseLength)
                .optimize(optimize)
                .cacheSizeMb(cacheSizeMb)
                .busyTimeout(busyTimeout)
                .lockTimeout(lockTimeout)
                .valueCodec(valueCodec)
                .valueEncryptor(valueEncryptor)
                .clock(clock);
    }

    private static String prop(Properties props, String key) {
        String value = props.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static boolean parseBoolean(String key, String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("false")) {
            return Boolean.parseBoolean(lower);
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": '" + value + "'");
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static Duration parseDuration(String key, String value) {
        try {
            if (value.regionMatches(true, 0, "P", 0, 1)) {
                return Duration.parse(value);
            }
            return Duration.ofMillis(Long.parseLong(value));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": '" + value + "'", e);
        }
    }

    private static CacheStrategy parseStrategy(String value) {
        try {
            return CacheStrategy.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cache strategy: '" + value
                    + "' (expected one of " + Arrays.toString(CacheStrategy.values()) + ")", e);
        }
    }

    private static Set<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public static final class Builder {
        private String tableName = DEFAULT_TABLE;
        private boolean bulkPreload;
        private CacheStrategy cacheStrategy = CacheStrategy.UNBOUNDED;
        private Integer cacheCapacity;
        private Duration cacheTtl;
        private boolean cacheCascadeDelete;
        private int workerCount = DEFAULT_WORKER_COUNT;
        private String threadNamePrefix = "drawer";
        private int readPoolSize;
        private boolean strictValidation = true;
        private Set<String> allowedFunctions = Set.of();
        private Set<String> forbiddenFunctions = Set.of();
        private int maxClauseLength = ClauseValidator.DEFAULT_MAX_LENGTH;
        private boolean optimize = true;
        private int cacheSizeMb = 64;
        private Duration busyTimeout;
        private Duration lockTimeout;
        private ValueCodec valueCodec;
        private ValueEncryptor valueEncryptor;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder tableName(String tableName) {
            this.tableName = Objects.requireNonNull(tableName, "tableName");
            return this;
        }

        /**
         * Load the whole table into the cache when the drawer is opened.
         */
        public Builder bulkPreload(boolean bulkPreload) {
            this.bulkPreload = bulkPreload;
            return this;
        }

        public Builder cacheStrategy(CacheStrategy cacheStrategy) {
            this.cacheStrategy = Objects.requireNonNull(cacheStrategy, "cacheStrategy");
            return this;
        }

        public Builder cacheCapacity(Integer cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        /**
         * TTL only: delete the stored row too when a cached entry expires.
         */
        public Builder cacheCascadeDelete(boolean cacheCascadeDelete) {
            this.cacheCascadeDelete = cacheCascadeDelete;
            return this;
        }

        /**
         * Shortcut for {@code cacheStrategy(LRU).cacheCapacity(capacity)}.
         */
        public Builder lru(int capacity) {
            return cacheStrategy(CacheStrategy.LRU).cacheCapacity(capacity);
        }

        /**
         * Shortcut for {@code cacheStrategy(TTL).cacheTtl(ttl).cacheCascadeDelete(cascadeDelete)}.
         */
        public Builder ttl(Duration ttl, boolean cascadeDelete) {
            return cacheStrategy(CacheStrategy.TTL).cacheTtl(ttl).cacheCascadeDelete(cascadeDelete);
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
            return this;
        }

        /**
         * Number of read-only connections for parallel async reads; 0 disables the pool.
         */
        public Builder readPoolSize(int readPoolSize) {
            this.readPoolSize = readPoolSize;
            return this;
        }

        public Builder strictValidation(boolean strictValidation) {
            this.strictValidation = strictValidation;
            return this;
        }

        public Builder allowedFunctions(Collection<String> allowedFunctions) {
            this.allowedFunctions = new LinkedHashSet<>(allowedFunctions);
            return this;
        }

        public Builder forbiddenFunctions(Collection<String> forbiddenFunctions) {
            this.forbiddenFunctions = new LinkedHashSet<>(forbiddenFunctions);
            return this;
        }

        public Builder maxClauseLength(int maxClauseLength) {
            this.maxClauseLength = maxClauseLength;
            return this;
        }

        /**
         * SQLite: WAL journal, synchronous=NORMAL, page cache of {@link #cacheSizeMb}, in-memory temp store.
         */
        public Builder optimize(boolean optimize) {
            this.optimize = optimize;
            return this;
        }

        public Builder cacheSizeMb(int cacheSizeMb) {
            this.cacheSizeMb = cacheSizeMb;
            return this;
        }

        /**
         * Bounded wait on the engine's own lock. Expiry surfaces as a DatabaseException.
         */
        public Builder busyTimeout(Duration busyTimeout) {
            this.busyTimeout = busyTimeout;
            return this;
        }

        /**
         * Bounded wait on the in-process connection mutex. Expiry surfaces as a LockException.
         */
        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public Builder valueCodec(ValueCodec valueCodec) {
            this.valueCodec = valueCodec;
            return this;
        }

        public Builder valueEncryptor(ValueEncryptor valueEncryptor) {
            this.valueEncryptor = valueEncryptor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * @throws de.t14d3.drawer.exceptions.ValidationException if the table name is not a plain identifier
         * @throws IllegalArgumentException                        if the other settings are inconsistent
         */
        public DrawerOptions build() {
            ClauseValidator.validateIdentifier(tableName, "table name");
            if (workerCount <= 0) {
                throw new IllegalArgumentException("workerCount must be > 0, got " + workerCount);
            }
            if (readPoolSize < 0) {
                throw new IllegalArgumentException("readPoolSize must be >= 0, got " + readPoolSize);
            }
            if (maxClauseLength <= 0) {
                throw new IllegalArgumentException("maxClauseLength must be > 0, got " + maxClauseLength);
            }
            if (cacheSizeMb <= 0) {
                throw new IllegalArgumentException("cacheSizeMb must be > 0, got " + cacheSizeMb);
            }
            // fail early on an incomplete cache policy
            CachePolicy.of(cacheStrategy, cacheCapacity, cacheTtl, cacheCascadeDelete);
            return new DrawerOptions(this);
        }
    }
}
