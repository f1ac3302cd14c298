package de.t14d3.drawer.connection;

import java.time.Duration;

/**
 * Engine tuning applied when the writer connection is opened.
 *
 * @param optimize    SQLite: WAL journal, synchronous=NORMAL, in-memory temp store
 * @param cacheSizeMb SQLite page cache size
 * @param busyTimeout bounded wait on the engine's own lock, or {@code null} for the driver default
 * @param lockTimeout bounded wait on the broker mutex, or {@code null} to wait indefinitely
 */
public record EngineSettings(boolean optimize, int cacheSizeMb, Duration busyTimeout, Duration lockTimeout) {

    public static EngineSettings defaults() {
        return new EngineSettings(true, 64, null, null);
    }
}
