package de.t14d3.drawer.exceptions;

// Reserved for lock acquisition timeouts.
public class LockException extends DrawerException {
    public LockException(String message) {
        super(message);
    }

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
