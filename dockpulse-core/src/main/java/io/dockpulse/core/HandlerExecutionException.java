package io.dockpulse.core;

/**
 * Thrown by job handlers. The optional counts describe work done before the failure, e.g.
 * "processed 12 of 40 before an external rate limit".
 */
public class HandlerExecutionException extends BatchException {

    private final long itemsChecked;
    private final long itemsUpdated;

    public HandlerExecutionException(String message) {
        this(message, null, 0, 0);
    }

    public HandlerExecutionException(String message, Throwable cause) {
        this(message, cause, 0, 0);
    }

    public HandlerExecutionException(String message, Throwable cause, long itemsChecked, long itemsUpdated) {
        super(message, cause);
        this.itemsChecked = itemsChecked;
        this.itemsUpdated = itemsUpdated;
    }

    public long getItemsChecked() {
        return itemsChecked;
    }

    public long getItemsUpdated() {
        return itemsUpdated;
    }
}
