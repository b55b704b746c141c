package io.dockpulse.core;

/**
 * Result of the persisted check-and-acquire step.
 *
 * held       : another run for the same (user, job type) is still RUNNING
 * runId      : id of that run when held
 * staleRunId : id of a RUNNING run that was older than the stale threshold and got force-failed
 */
public record LockCheck(
        boolean held,
        String runId,
        String staleRunId
) {

    public static LockCheck free() {
        return new LockCheck(false, null, null);
    }

    public static LockCheck releasedStale(String staleRunId) {
        return new LockCheck(false, null, staleRunId);
    }

    public static LockCheck heldBy(String runId) {
        return new LockCheck(true, runId, null);
    }
}
