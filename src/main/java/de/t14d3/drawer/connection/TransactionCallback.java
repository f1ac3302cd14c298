package de.t14d3.drawer.connection;

/**
 * Unit of work run between begin and commit.
 */
@FunctionalInterface
public interface TransactionCallback<T, X extends Exception> {
    T doInTransaction() throws X;
}
