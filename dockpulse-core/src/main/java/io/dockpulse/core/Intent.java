package io.dockpulse.core;

import java.time.Instant;
import java.util.Objects;

/**
 * User-defined auto-upgrade rule.
 *
 * <p>{@code lastEvaluatedAt} starts at {@code createdAt} and afterwards only advances to cron trigger
 * instants the engine has consumed.
 */
public record Intent(
        String id,
        String userId,
        String name,
        boolean enabled,
        ScheduleType scheduleType,
        String scheduleCron,
        Instant lastEvaluatedAt,
        Instant createdAt
) {

    public Intent {
        Objects.requireNonNull(scheduleType, "scheduleType must not be null");
    }

    public boolean isScheduled() {
        return scheduleType == ScheduleType.SCHEDULED;
    }

    public boolean isImmediate() {
        return scheduleType == ScheduleType.IMMEDIATE;
    }

    public Intent withLastEvaluatedAt(Instant at) {
        return new Intent(id, userId, name, enabled, scheduleType, scheduleCron, at, createdAt);
    }
}
