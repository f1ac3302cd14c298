package de.t14d3.drawer.exceptions;

/**
 * Operation attempted on a closed drawer, or on a child whose root connection was closed.
 */
public class ClosedException extends ConnectionException {
    public ClosedException(String message) {
        super(message);
    }
}
