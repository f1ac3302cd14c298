package de.t14d3.drawer.exceptions;

/**
 * Transaction misuse: nesting, commit or rollback while idle, or closing while active.
 * Raised without changing the transaction state.
 */
public class TransactionException extends DrawerException {
    public TransactionException(String message) {
        super(message);
    }

    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
