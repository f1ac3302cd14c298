package de.t14d3.drawer.storage;

/**
 * A decoded value read from storage. Wraps the value so a stored JSON {@code null}
 * can be told apart from a missing row.
 */
public record StoredValue(Object value) {
}
