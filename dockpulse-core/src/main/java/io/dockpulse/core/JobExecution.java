package io.dockpulse.core;

import io.dockpulse.JobResult;

/**
 * Successful outcome of {@link io.dockpulse.BatchSystem#executeJob(String, String, boolean)}.
 */
public record JobExecution(
        String runId,
        JobKey key,
        boolean manual,
        JobResult result,
        String logs
) {
}
