package io.dockpulse.core;

import java.util.Objects;

/**
 * Identity of a lockable unit of batch work.
 */
public record JobKey(String userId, String jobType) implements Comparable<JobKey> {

    public JobKey {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(jobType, "jobType must not be null");
    }

    @Override
    public int compareTo(JobKey other) {
        int c = userId.compareTo(other.userId);
        return c != 0 ? c : jobType.compareTo(other.jobType);
    }

    @Override
    public String toString() {
        return userId + ":" + jobType;
    }
}
