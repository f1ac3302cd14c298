package de.t14d3.drawer.connection;

import java.util.Set;

/**
 * A cache namespace that wrote keys during the active transaction and must drop them if it rolls back.
 */
@FunctionalInterface
public interface TransactionParticipant {
    void rolledBack(Set<String> keys);
}
