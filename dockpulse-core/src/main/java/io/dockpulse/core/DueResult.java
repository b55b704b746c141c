package io.dockpulse.core;

import java.time.Instant;

/**
 * Outcome of a cron due-ness check.
 *
 * due         : a cron boundary was crossed since the last evaluation
 * nextRun     : next boundary strictly after "now" (null when the cron is invalid or exhausted)
 * triggerTime : the boundary to persist as lastEvaluatedAt when due
 * reason      : short human-readable explanation
 */
public record DueResult(
        boolean due,
        Instant nextRun,
        Instant triggerTime,
        String reason
) {

    public static DueResult notDue(Instant nextRun, String reason) {
        return new DueResult(false, nextRun, null, reason);
    }

    public static DueResult dueAt(Instant triggerTime, Instant nextRun, String reason) {
        return new DueResult(true, nextRun, triggerTime, reason);
    }
}
