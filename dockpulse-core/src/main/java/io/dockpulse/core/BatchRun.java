package io.dockpulse.core;

import java.time.Instant;

/**
 * One persisted execution attempt of a job for a user.
 *
 * <p>A run in status {@link BatchRunStatus#RUNNING} is the durable half of the (user, job type) lock.
 */
public record BatchRun(
        String id,
        String userId,
        String jobType,
        BatchRunStatus status,
        boolean manual,

        Instant startedAt,
        Instant completedAt,
        Long durationMs,

        long itemsChecked,
        long itemsUpdated,
        String partialReason,
        String errorMessage,
        String logs
) {

    public static BatchRun started(String id, String userId, String jobType, boolean manual, Instant startedAt) {
        return new BatchRun(id, userId, jobType, BatchRunStatus.RUNNING, manual, startedAt,
                null, null, 0, 0, null, null, null);
    }

    public boolean isRunning() {
        return status == BatchRunStatus.RUNNING;
    }

    public JobKey key() {
        return new JobKey(userId, jobType);
    }
}
