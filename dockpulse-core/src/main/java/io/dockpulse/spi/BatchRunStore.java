package io.dockpulse.spi;

import io.dockpulse.JobResult;
import io.dockpulse.core.BatchRun;
import io.dockpulse.core.LockCheck;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable batch run records. A RUNNING run is the persisted lock for its (user, job type) pair.
 *
 * <p>Implementations wrap storage failures in {@link io.dockpulse.core.PersistenceException}.
 */
public interface BatchRunStore {

    /**
     * Check whether the pair is free to run.
     *
     * <p>A RUNNING run started before {@code now - staleAfter} is force-failed as interrupted and does not
     * block; any other RUNNING run is reported as holding the lock.
     */
    LockCheck checkLock(String userId, String jobType, Duration staleAfter, Instant now);

    /**
     * Insert a RUNNING run. Must be atomic with respect to other RUNNING runs for the same pair and fail
     * with {@link io.dockpulse.core.LockConflictException} when one already exists.
     */
    BatchRun createRun(String userId, String jobType, boolean manual, Instant startedAt);

    void completeRun(String runId, JobResult result, String logs, Instant completedAt);

    void failRun(String runId, String errorMessage, long itemsChecked, long itemsUpdated, String logs, Instant completedAt);

    Optional<BatchRun> findById(String runId);

    Optional<BatchRun> findLatestCompleted(String userId, String jobType);

    /**
     * Most recent runs first.
     */
    List<BatchRun> findRecent(String userId, int limit);

    /**
     * Force every RUNNING run to FAILED. Used on startup, before any polling begins.
     *
     * @return number of runs updated
     */
    int failStaleRuns(String reason, Instant now);
}
