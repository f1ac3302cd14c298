package de.t14d3.drawer.exceptions;

// Reserved for cache consistency signaling.
public class CacheException extends DrawerException {
    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
