package de.t14d3.drawer.exceptions;

public class ConnectionException extends DrawerException {
    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
