package de.t14d3.drawer.connection;

import de.t14d3.drawer.query.Dialect;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * Where a root drawer stores its data, resolved from a path or URL to a JDBC URL.
 *
 * Accepted forms:
 * <ul>
 *   <li>a filesystem path, or {@code :memory:}</li>
 *   <li>{@code sqlite:///path/to/file.db} and {@code file:///path/to/file.db}</li>
 *   <li>a raw {@code jdbc:sqlite:} or {@code jdbc:h2:} URL</li>
 * </ul>
 */
public final class DatabaseTarget {
    public static final String MEMORY = ":memory:";

    private final String jdbcUrl;
    private final Dialect dialect;
    private final boolean inMemory;

    private DatabaseTarget(String jdbcUrl, Dialect dialect, boolean inMemory) {
        this.jdbcUrl = jdbcUrl;
        this.dialect = dialect;
        this.inMemory = inMemory;
    }

    /**
     * @throws UnsupportedOperationException for PostgreSQL URLs
     * @throws IllegalArgumentException      for blank targets and unknown schemes
     */
    public static DatabaseTarget resolve(String target) {
        Objects.requireNonNull(target, "target");
        String trimmed = target.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Database target must not be blank");
        }
        if (trimmed.regionMatches(true, 0, "jdbc:", 0, 5)) {
            Dialect dialect = Dialect.detectFromUrl(trimmed);
            String lower = trimmed.toLowerCase(Locale.ROOT);
            // named H2 memory databases are shared inside the JVM, unnamed ones are not
            boolean memory = lower.startsWith("jdbc:sqlite::memory:") || lower.equals("jdbc:sqlite:")
                    || lower.equals("jdbc:h2:mem:") || lower.startsWith("jdbc:h2:mem:;");
            return new DatabaseTarget(trimmed, dialect, memory);
        }
        if (trimmed.contains("://")) {
            return fromUrl(trimmed);
        }
        return sqlite(trimmed);
    }

    private static DatabaseTarget fromUrl(String target) {
        URI uri;
        try {
            uri = new URI(target);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed database URL: " + target, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        switch (scheme) {
            case "sqlite", "file" -> {
                String path = uri.getPath() == null ? "" : uri.getPath();
                // Windows drive letters keep a leading slash after parsing: /C:/data.db
                if (path.startsWith("/") && path.length() > 3 && path.charAt(2) == ':') {
                    path = path.substring(1);
                }
                return sqlite(path.isEmpty() ? MEMORY : path);
            }
            case "postgresql", "postgres" -> throw new UnsupportedOperationException(
                    "PostgreSQL backend is not implemented; use a SQLite path or sqlite:/// URL");
            default -> throw new IllegalArgumentException("Unsupported or unknown database target: " + target);
        }
    }

    private static DatabaseTarget sqlite(String path) {
        boolean memory = MEMORY.equals(path);
        return new DatabaseTarget("jdbc:sqlite:" + path, Dialect.SQLITE, memory);
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    public Dialect dialect() {
        return dialect;
    }

    /**
     * Private in-memory stores live inside one connection, so they cannot back a read pool.
     */
    public boolean inMemory() {
        return inMemory;
    }

    @Override
    public String toString() {
        return jdbcUrl;
    }
}
