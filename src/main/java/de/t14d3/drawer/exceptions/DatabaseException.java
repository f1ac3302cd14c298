package de.t14d3.drawer.exceptions;

/**
 * The underlying engine failed. The original cause is always attached.
 */
public class DatabaseException extends DrawerException {
    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
