package io.dockpulse.core;

/**
 * A durable store read or write failed.
 */
public class PersistenceException extends BatchException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
