package io.dockpulse.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dockpulse.BatchSystem;
import io.dockpulse.JobContext;
import io.dockpulse.JobHandler;
import io.dockpulse.JobLogger;
import io.dockpulse.JobResult;
import io.dockpulse.config.BatchProperties;
import io.dockpulse.core.BatchException;
import io.dockpulse.core.BatchRun;
import io.dockpulse.core.BatchStatus;
import io.dockpulse.core.HandlerExecutionException;
import io.dockpulse.core.JobExecution;
import io.dockpulse.core.JobHandlerRegistry;
import io.dockpulse.core.JobKey;
import io.dockpulse.core.LockCheck;
import io.dockpulse.core.LockConflictException;
import io.dockpulse.spi.BatchConfigSource;
import io.dockpulse.spi.BatchRunStore;
import io.dockpulse.spi.IntentStore;
import io.dockpulse.spi.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch engine.
 *
 * <p>Core responsibilities:
 * <ul>
 *   <li>Job handler registration</li>
 *   <li>At most one run per (user, job type), guarded in memory and by the persisted RUNNING record</li>
 *   <li>Run bookkeeping: RUNNING, then COMPLETED or FAILED with counts and the captured log transcript</li>
 *   <li>Lifecycle of the interval {@link Scheduler} and the {@link IntentEvaluator}</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * batchManager.registerHandler(new UpdateCheckHandler(...));
 * batchManager.start();
 *
 * batchManager.executeJob("user-1", "update-check", true)
 *         .thenAccept(execution -> ...);
 * batchManager.stop();
 * }</pre>
 */
public class BatchManager implements BatchSystem {
    private static final Logger log = LoggerFactory.getLogger(BatchManager.class);

    static final String RESTART_REASON = "Job was interrupted (server restart detected)";
    static final String INTENT_RESTART_REASON = "Intent execution was interrupted (server restart detected)";

    private final BatchProperties props;
    private final BatchRunStore runStore;
    private final IntentStore intentStore;
    private final JobHandlerRegistry registry = new JobHandlerRegistry();
    private final Scheduler scheduler;
    private final IntentEvaluator intentEvaluator;
    private final ScanCompletionBus scanEvents;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ConcurrentHashMap<JobKey, RunningJob> running = new ConcurrentHashMap<>();

    private final Executor injectedExecutor;
    private ExecutorService workerPool;

    /**
     * In-process lock marker. {@code runId} stays null until the run record exists.
     */
    private static final class RunningJob {
        private final boolean manual;
        private final Instant startedAt;
        private volatile String runId;

        private RunningJob(boolean manual, Instant startedAt) {
            this.manual = manual;
            this.startedAt = startedAt;
        }
    }

    public BatchManager(BatchProperties props,
                        BatchRunStore runStore,
                        BatchConfigSource configSource,
                        UserDirectory userDirectory,
                        IntentStore intentStore,
                        IntentEvaluator intentEvaluator,
                        ScanCompletionBus scanEvents,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this(props, runStore, configSource, userDirectory, intentStore, intentEvaluator, scanEvents, objectMapper, clock, null);
    }

    /**
     * @param executor runs job handlers; when null the manager owns a fixed pool of
     *                 {@code maxConcurrency} daemon threads, created on first use and shut down on {@link #stop()}
     */
    public BatchManager(BatchProperties props,
                        BatchRunStore runStore,
                        BatchConfigSource configSource,
                        UserDirectory userDirectory,
                        IntentStore intentStore,
                        IntentEvaluator intentEvaluator,
                        ScanCompletionBus scanEvents,
                        ObjectMapper objectMapper,
                        Clock clock,
                        Executor executor) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.runStore = Objects.requireNonNull(runStore, "runStore must not be null");
        this.intentStore = Objects.requireNonNull(intentStore, "intentStore must not be null");
        this.intentEvaluator = Objects.requireNonNull(intentEvaluator, "intentEvaluator must not be null");
        this.scanEvents = Objects.requireNonNull(scanEvents, "scanEvents must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.injectedExecutor = executor;
        this.scheduler = new Scheduler(this, runStore, configSource, userDirectory, props, clock);
    }

    /**
     * Sweep interrupted runs and executions, then start the scheduler and the intent evaluator.
     * Should be idempotent.
     */
    @Override
    public void start() {
        if (registry.isEmpty()) {
            log.warn("BatchManager has no registered job handlers, not starting");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        try {
            props.validate();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        log.info("BatchManager starting jobTypes={} checkInterval={} intentCheckInterval={} maxConcurrency={} staleRunThreshold={}",
                registry.jobTypes(),
                props.getCheckInterval(),
                props.getIntentCheckInterval(),
                props.getMaxConcurrency(),
                props.getStaleRunThreshold());

        Instant now = clock.instant();
        try {
            int failed = runStore.failStaleRuns(RESTART_REASON, now);
            if (failed > 0) {
                log.warn("BatchManager marked interrupted runs as failed count={}", failed);
            }
        } catch (RuntimeException e) {
            log.error("batch stale run sweep failed msg={}", e.getMessage(), e);
        }
        try {
            int failed = intentStore.failStaleExecutions(INTENT_RESTART_REASON, now);
            if (failed > 0) {
                log.warn("BatchManager marked interrupted intent executions as failed count={}", failed);
            }
        } catch (RuntimeException e) {
            log.error("intent stale execution sweep failed msg={}", e.getMessage(), e);
        }

        scheduler.start();
        intentEvaluator.start();
        log.info("BatchManager started successfully.");
    }

    /**
     * Stop both pollers and drain the owned worker pool. Should be idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("BatchManager stopping...");
        scheduler.stop();
        intentEvaluator.stop();

        ExecutorService pool;
        synchronized (this) {
            pool = workerPool;
            workerPool = null;
        }
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("BatchManager worker pool did not drain within {}, interrupting running={}",
                            props.getShutdownTimeout(), running.keySet());
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            }
        }
        log.info("BatchManager stopped successfully.");
    }

    @Override
    public void registerHandler(JobHandler handler) {
        registry.register(handler);
        log.info("Registered job handler jobType={} displayName={}", handler.jobType(), handler.displayName());
    }

    @Override
    public List<String> getRegisteredJobTypes() {
        return registry.jobTypes();
    }

    public Optional<JobHandler> getHandler(String jobType) {
        return registry.find(jobType);
    }

    @Override
    public CompletableFuture<JobExecution> executeJob(String userId, String jobType, boolean manual) {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(jobType, "jobType must not be null");

        JobHandler handler = registry.getRequired(jobType);
        JobKey key = new JobKey(userId, jobType);
        Instant now = clock.instant();

        // a run this process is still executing must never be reaped as stale
        RunningJob live = running.get(key);
        if (live != null) {
            throw new LockConflictException(userId, jobType, live.runId);
        }

        LockCheck lock = runStore.checkLock(userId, jobType, props.getStaleRunThreshold(), now);
        if (lock.staleRunId() != null) {
            log.warn("Released stale run key={} runId={} staleRunThreshold={}",
                    key, lock.staleRunId(), props.getStaleRunThreshold());
        }
        if (lock.held()) {
            throw new LockConflictException(userId, jobType, lock.runId());
        }

        RunningJob marker = new RunningJob(manual, now);
        RunningJob existing = running.putIfAbsent(key, marker);
        if (existing != null) {
            throw new LockConflictException(userId, jobType, existing.runId);
        }

        BatchRun run;
        try {
            run = runStore.createRun(userId, jobType, manual, now);
        } catch (RuntimeException e) {
            running.remove(key, marker);
            throw e;
        }
        marker.runId = run.id();

        JobLogger jobLog = new JobLogger(jobType, clock, objectMapper);
        jobLog.bindRun(run.id());

        log.info("Batch job started key={} runId={} manual={}", key, run.id(), manual);

        CompletableFuture<JobExecution> future = new CompletableFuture<>();
        try {
            executor().execute(() -> runJob(handler, key, marker, run.id(), jobLog, future));
        } catch (RejectedExecutionException e) {
            log.error("batch job rejected key={} runId={} msg={}", key, run.id(), e.getMessage(), e);
            failRunQuietly(key, run.id(), "Job could not be scheduled: worker pool rejected it", 0, 0, jobLog);
            if (!manual) {
                scheduler.recordFailure(userId, jobType, clock.instant());
            }
            running.remove(key, marker);
            future.completeExceptionally(new BatchException("Job " + jobType + " could not be scheduled for user " + userId, e));
        }
        return future;
    }

    private void runJob(JobHandler handler,
                        JobKey key,
                        RunningJob marker,
                        String runId,
                        JobLogger jobLog,
                        CompletableFuture<JobExecution> future) {
        JobExecution execution = null;
        Throwable failure = null;
        try {
            JobResult result = handler.execute(new JobContext(jobLog, key.userId()));
            if (result == null) {
                result = JobResult.empty();
            }
            Instant completedAt = clock.instant();
            String logs = jobLog.formattedLogs();

            try {
                runStore.completeRun(runId, result, logs, completedAt);
            } catch (RuntimeException e) {
                log.error("batch completeRun failed key={} runId={} msg={}", key, runId, e.getMessage(), e);
            }
            scheduler.updateLastRunTime(key.userId(), key.jobType(), completedAt);

            log.info("Batch job completed key={} runId={} durationMs={} itemsChecked={} itemsUpdated={}{}",
                    key, runId,
                    Duration.between(marker.startedAt, completedAt).toMillis(),
                    result.itemsChecked(), result.itemsUpdated(),
                    result.isPartial() ? " partialReason=" + result.partialReason() : "");

            if (result.hasUpdates()) {
                scanEvents.publish(key.userId(), key.jobType(), result);
            }
            execution = new JobExecution(runId, key, marker.manual, result, logs);
        } catch (Exception | Error e) {
            failure = e;
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            long itemsChecked = 0;
            long itemsUpdated = 0;
            if (e instanceof HandlerExecutionException hee) {
                itemsChecked = hee.getItemsChecked();
                itemsUpdated = hee.getItemsUpdated();
            }
            jobLog.error("Job failed: " + message, e);
            log.error("batch job failed key={} runId={} msg={}", key, runId, message, e);

            failRunQuietly(key, runId, message, itemsChecked, itemsUpdated, jobLog);
            if (!marker.manual) {
                scheduler.recordFailure(key.userId(), key.jobType(), clock.instant());
            }
        } finally {
            running.remove(key, marker);
        }

        if (failure != null) {
            future.completeExceptionally(failure);
        } else {
            future.complete(execution);
        }
        if (failure instanceof VirtualMachineError fatal) {
            throw fatal;
        }
    }

    private void failRunQuietly(JobKey key, String runId, String message, long itemsChecked, long itemsUpdated, JobLogger jobLog) {
        try {
            runStore.failRun(runId, message, itemsChecked, itemsUpdated, jobLog.formattedLogs(), clock.instant());
        } catch (RuntimeException e) {
            log.error("batch failRun failed key={} runId={} msg={}", key, runId, e.getMessage(), e);
        }
    }

    private synchronized Executor executor() {
        if (injectedExecutor != null) {
            return injectedExecutor;
        }
        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("dockpulse.worker");
                t.setDaemon(true);
                return t;
            });
        }
        return workerPool;
    }

    /**
     * In-process view only; a run held by another engine instance is detected at {@link #executeJob}.
     */
    @Override
    public boolean isRunning(String userId, String jobType) {
        return running.containsKey(new JobKey(userId, jobType));
    }

    public List<JobKey> getRunningJobs() {
        List<JobKey> runningJobs = new ArrayList<>(running.keySet());
        Collections.sort(runningJobs);
        return runningJobs;
    }

    @Override
    public List<BatchRun> getRecentRuns(String userId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        return runStore.findRecent(userId, limit);
    }

    @Override
    public BatchStatus getStatus() {
        return new BatchStatus(
                started.get(),
                registry.jobTypes(),
                getRunningJobs(),
                scheduler.getStatus(),
                intentEvaluator.getStatus()
        );
    }

    public boolean isStarted() {
        return started.get();
    }

    public Scheduler scheduler() {
        return scheduler;
    }
}
