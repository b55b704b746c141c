package io.dockpulse.core;

/**
 * Invalid or missing settings: unparsable cron, disabled or sub-minimum interval, unknown job type.
 * Work guarded by such settings never runs and is not retried automatically.
 */
public class ConfigurationException extends BatchException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
