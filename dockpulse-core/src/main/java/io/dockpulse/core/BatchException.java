package io.dockpulse.core;

/**
 * Root of the engine's unchecked exceptions.
 */
public class BatchException extends RuntimeException {

    public BatchException(String message) {
        super(message);
    }

    public BatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
