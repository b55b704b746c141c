package io.dockpulse.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * lastRunTimes is keyed by "userId:jobType".
 */
public record SchedulerStatus(
        boolean running,
        boolean initialized,
        Duration checkInterval,
        Map<String, Instant> lastRunTimes
) {
}
