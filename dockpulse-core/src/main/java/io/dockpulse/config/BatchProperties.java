package io.dockpulse.config;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Runtime configuration for the batch engine.
 *
 * <p>Bound under the {@code dockpulse} prefix by the Spring Boot starter.
 */
public class BatchProperties {
    private boolean enabled = true;
    private Duration checkInterval = Duration.ofSeconds(30); // interval job poller
    private Duration intentCheckInterval = Duration.ofSeconds(60);
    private Duration intentStartupDelay = Duration.ofSeconds(10);
    private Duration failureCooldown = Duration.ofMinutes(1);
    private Duration staleRunThreshold = Duration.ofHours(1);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private int maxConcurrency = 4; // batch job workers
    private int intentConcurrency = 4;
    private String timeZone = "UTC";
    private boolean ensureIndexesOnStartup = true;

    /**
     * Fail fast on unusable settings.
     *
     * @throws IllegalArgumentException when a duration is not positive, a pool size is below 1 or the zone is unknown
     */
    public BatchProperties validate() {
        requirePositive(checkInterval, "dockpulse.checkInterval");
        requirePositive(intentCheckInterval, "dockpulse.intentCheckInterval");
        requirePositive(failureCooldown, "dockpulse.failureCooldown");
        requirePositive(staleRunThreshold, "dockpulse.staleRunThreshold");
        requirePositive(shutdownTimeout, "dockpulse.shutdownTimeout");
        Objects.requireNonNull(intentStartupDelay, "dockpulse.intentStartupDelay must not be null");
        if (intentStartupDelay.isNegative()) {
            throw new IllegalArgumentException("dockpulse.intentStartupDelay must not be negative");
        }
        if (maxConcurrency < 1 || intentConcurrency < 1) {
            throw new IllegalArgumentException("dockpulse.maxConcurrency and dockpulse.intentConcurrency must be at least 1");
        }
        zoneId();
        return this;
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public ZoneId zoneId() {
        try {
            return ZoneId.of(timeZone != null ? timeZone : "UTC");
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("dockpulse.timeZone is not a valid zone id: " + timeZone, ex);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }

    public Duration getIntentCheckInterval() {
        return intentCheckInterval;
    }

    public void setIntentCheckInterval(Duration intentCheckInterval) {
        this.intentCheckInterval = intentCheckInterval;
    }

    public Duration getIntentStartupDelay() {
        return intentStartupDelay;
    }

    public void setIntentStartupDelay(Duration intentStartupDelay) {
        this.intentStartupDelay = intentStartupDelay;
    }

    public Duration getFailureCooldown() {
        return failureCooldown;
    }

    public void setFailureCooldown(Duration failureCooldown) {
        this.failureCooldown = failureCooldown;
    }

    public Duration getStaleRunThreshold() {
        return staleRunThreshold;
    }

    public void setStaleRunThreshold(Duration staleRunThreshold) {
        this.staleRunThreshold = staleRunThreshold;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getIntentConcurrency() {
        return intentConcurrency;
    }

    public void setIntentConcurrency(int intentConcurrency) {
        this.intentConcurrency = intentConcurrency;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
