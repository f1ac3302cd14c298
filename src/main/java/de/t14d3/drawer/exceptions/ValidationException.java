package de.t14d3.drawer.exceptions;

/**
 * A caller-supplied identifier or clause fragment was rejected before any I/O happened.
 */
public class ValidationException extends DrawerException {
    public ValidationException(String message) {
        super(message);
    }
}
