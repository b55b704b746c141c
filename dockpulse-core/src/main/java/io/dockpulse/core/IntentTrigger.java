package io.dockpulse.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Why an intent is being executed.
 *
 * @param type        trigger path
 * @param triggerTime cron boundary for {@link TriggerType#SCHEDULED_WINDOW}; detection time otherwise
 */
public record IntentTrigger(TriggerType type, Instant triggerTime) {

    public IntentTrigger {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(triggerTime, "triggerTime must not be null");
    }

    public static IntentTrigger scheduledWindow(Instant cronBoundary) {
        return new IntentTrigger(TriggerType.SCHEDULED_WINDOW, cronBoundary);
    }

    public static IntentTrigger scanDetected(Instant detectedAt) {
        return new IntentTrigger(TriggerType.SCAN_DETECTED, detectedAt);
    }
}
