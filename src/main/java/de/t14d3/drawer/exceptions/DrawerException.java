package de.t14d3.drawer.exceptions;

/**
 * Base type for every failure raised by the store.
 */
public class DrawerException extends RuntimeException {
    public DrawerException(String message) {
        super(message);
    }

    public DrawerException(Throwable cause) {
        super(cause);
    }

    public DrawerException(String message, Throwable cause) {
        super(message, cause);
    }
}
