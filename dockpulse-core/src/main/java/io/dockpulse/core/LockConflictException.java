package io.dockpulse.core;

/**
 * The (user, job type) pair already has a run in flight.
 *
 * <p>{@link #getRunId()} is null only when the competing run was caught by the in-process guard before
 * its record was written.
 */
public class LockConflictException extends BatchException {

    private final String userId;
    private final String jobType;
    private final String runId;

    public LockConflictException(String userId, String jobType, String runId) {
        super("Job " + jobType + " is already running for user " + userId
                + (runId != null ? " (run " + runId + ")" : ""));
        this.userId = userId;
        this.jobType = jobType;
        this.runId = runId;
    }

    public String getUserId() {
        return userId;
    }

    public String getJobType() {
        return jobType;
    }

    public String getRunId() {
        return runId;
    }
}
