package io.dockpulse.core;

import java.time.Duration;

/**
 * Per (user, job type) schedule settings. Owned by the settings layer; read-only to the engine.
 */
public record BatchConfig(boolean enabled, int intervalMinutes) {

    public static final int MIN_INTERVAL_MINUTES = 1;
    public static final int MAX_INTERVAL_MINUTES = 1440;
    public static final int DEFAULT_INTERVAL_MINUTES = 60;

    public static BatchConfig defaults() {
        return new BatchConfig(false, DEFAULT_INTERVAL_MINUTES);
    }

    public static BatchConfig enabledEvery(int intervalMinutes) {
        return new BatchConfig(true, intervalMinutes);
    }

    /**
     * True when the scheduler may dispatch this job. Disabled configs and sub-minimum intervals fail closed.
     */
    public boolean isSchedulable() {
        return enabled && intervalMinutes >= MIN_INTERVAL_MINUTES;
    }

    public Duration interval() {
        return Duration.ofMinutes(intervalMinutes);
    }

    /**
     * Write-time validation used by the settings layer.
     */
    public BatchConfig validate() {
        if (intervalMinutes < MIN_INTERVAL_MINUTES) {
            throw new ConfigurationException("Interval must be at least " + MIN_INTERVAL_MINUTES + " minute");
        }
        if (intervalMinutes > MAX_INTERVAL_MINUTES) {
            throw new ConfigurationException("Interval cannot exceed " + MAX_INTERVAL_MINUTES + " minutes (24 hours)");
        }
        return this;
    }
}
