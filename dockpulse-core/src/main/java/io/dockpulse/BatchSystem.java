package io.dockpulse;

import io.dockpulse.core.BatchRun;
import io.dockpulse.core.BatchStatus;
import io.dockpulse.core.JobExecution;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Main batch engine API.
 *
 * <p>Owns job handler registration, the per-(user, job type) execution lock, and the lifecycle of
 * the interval scheduler and the intent evaluator.
 */
public interface BatchSystem {
    void start();

    void stop();

    void registerHandler(JobHandler handler);

    List<String> getRegisteredJobTypes();

    /**
     * Run a job for a user.
     *
     * <p>Lock acquisition happens on the calling thread: a job that is already running for the same
     * user fails immediately with {@link io.dockpulse.core.LockConflictException}. The handler itself
     * runs on the worker pool and its outcome is delivered through the returned future.
     */
    CompletableFuture<JobExecution> executeJob(String userId, String jobType, boolean manual);

    boolean isRunning(String userId, String jobType);

    List<BatchRun> getRecentRuns(String userId, int limit);

    BatchStatus getStatus();
}
