package io.dockpulse.internal;

import io.dockpulse.JobHandler;
import io.dockpulse.config.BatchProperties;
import io.dockpulse.core.BatchConfig;
import io.dockpulse.core.BatchException;
import io.dockpulse.core.JobExecution;
import io.dockpulse.core.JobKey;
import io.dockpulse.core.LockConflictException;
import io.dockpulse.core.SchedulerStatus;
import io.dockpulse.spi.BatchConfigSource;
import io.dockpulse.spi.BatchRunStore;
import io.dockpulse.spi.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Interval poller for batch jobs.
 *
 * <p>Every tick walks all (user, job type) pairs, and dispatches the ones whose interval has elapsed since
 * the last successful run. Due-ness is a wall-clock delta, so a late tick still picks up overdue work.
 *
 * <p>The last-run cache is written only on confirmed success ({@link #updateLastRunTime}) and on failure
 * ({@link #recordFailure}, pulled back so the job is due again after the failure cooldown). Dispatch never
 * writes it.
 */
public class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final BatchManager batchManager;
    private final BatchRunStore runStore;
    private final BatchConfigSource configSource;
    private final UserDirectory userDirectory;
    private final BatchProperties props;
    private final Clock clock;

    // absent key = never run
    private final ConcurrentHashMap<JobKey, Instant> lastRunTimes = new ConcurrentHashMap<>();
    // interval a scheduled dispatch used, until its outcome is recorded
    private final ConcurrentHashMap<JobKey, Duration> dispatchedIntervals = new ConcurrentHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean initialized = false;
    private ScheduledExecutorService ticker;

    public Scheduler(BatchManager batchManager,
                     BatchRunStore runStore,
                     BatchConfigSource configSource,
                     UserDirectory userDirectory,
                     BatchProperties props,
                     Clock clock) {
        this.batchManager = Objects.requireNonNull(batchManager, "batchManager must not be null");
        this.runStore = Objects.requireNonNull(runStore, "runStore must not be null");
        this.configSource = Objects.requireNonNull(configSource, "configSource must not be null");
        this.userDirectory = Objects.requireNonNull(userDirectory, "userDirectory must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Due iff the job never ran or at least {@code interval} has passed since {@code lastRunTime}.
     */
    public static boolean isDue(Instant lastRunTime, Duration interval, Instant now) {
        if (lastRunTime == null) {
            return true;
        }
        Duration sinceLastRun = Duration.between(lastRunTime, now);
        return sinceLastRun.compareTo(interval) >= 0;
    }

    /**
     * Load the latest completed run per (user, job type) so due-ness survives restarts. Runs once.
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }

        List<String> users = userDirectory.findAllUserIds();
        List<String> jobTypes = batchManager.getRegisteredJobTypes();
        log.info("Scheduler initializing users={} jobTypes={}", users.size(), jobTypes);

        for (String userId : users) {
            for (String jobType : jobTypes) {
                JobKey key = new JobKey(userId, jobType);
                try {
                    runStore.findLatestCompleted(userId, jobType)
                            .filter(run -> run.completedAt() != null)
                            .ifPresentOrElse(
                                    run -> {
                                        lastRunTimes.merge(key, run.completedAt(), Scheduler::laterOf);
                                        log.debug("scheduler loaded last run key={} completedAt={}", key, run.completedAt());
                                    },
                                    () -> log.debug("scheduler found no completed run key={}, will run on first check", key)
                            );
                } catch (RuntimeException e) {
                    log.warn("scheduler failed to load last run time key={} msg={}", key, e.getMessage());
                }
            }
        }

        initialized = true;
        log.info("Scheduler initialized lastRunTimes={}", lastRunTimes.size());
    }

    /**
     * Initialize and start the fixed-delay tick, first check immediately. Should be idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("Scheduler already running");
            return;
        }

        Duration interval = Objects.requireNonNull(props.getCheckInterval(), "dockpulse.checkInterval must not be null");
        try {
            initialize();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("dockpulse.scheduler");
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleWithFixedDelay(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Scheduler started checkInterval={}", interval);
    }

    /**
     * Stop polling. In-flight jobs keep running. Should be idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        if (ticker != null) {
            ticker.shutdownNow();
            ticker = null;
        }
        log.info("Scheduler stopped");
    }

    public boolean isRunning() {
        return started.get();
    }

    // A throwing tick would cancel the periodic task, so nothing escapes.
    private void tick() {
        try {
            checkAndScheduleJobs();
        } catch (Exception e) {
            log.error("scheduler check failed msg={}", e.getMessage(), e);
        }
    }

    /**
     * One polling pass over every (user, job type) pair.
     */
    public void checkAndScheduleJobs() {
        List<String> users = userDirectory.findAllUserIds();
        if (users.isEmpty()) {
            log.debug("scheduler check: no users");
            return;
        }

        Instant now = clock.instant();
        List<String> jobTypes = batchManager.getRegisteredJobTypes();
        log.debug("scheduler check now={} users={} jobTypes={}", now, users.size(), jobTypes);

        for (String userId : users) {
            Map<String, BatchConfig> configs;
            try {
                configs = configSource.findConfigs(userId);
            } catch (RuntimeException e) {
                log.error("scheduler failed to load batch configs userId={} msg={}", userId, e.getMessage(), e);
                continue;
            }

            for (String jobType : jobTypes) {
                try {
                    checkJob(userId, jobType, configs, now);
                } catch (RuntimeException e) {
                    log.error("scheduler check failed userId={} jobType={} msg={}", userId, jobType, e.getMessage(), e);
                }
            }
        }
    }

    private void checkJob(String userId, String jobType, Map<String, BatchConfig> configs, Instant now) {
        JobKey key = new JobKey(userId, jobType);
        BatchConfig config = configs.get(jobType);
        if (config == null) {
            config = batchManager.getHandler(jobType)
                    .map(JobHandler::defaultConfig)
                    .orElse(BatchConfig.defaults());
        }

        if (!config.isSchedulable()) {
            log.debug("scheduler skip key={} reason=disabled-or-invalid-interval enabled={} intervalMinutes={}",
                    key, config.enabled(), config.intervalMinutes());
            return;
        }

        if (batchManager.isRunning(userId, jobType)) {
            log.debug("scheduler skip key={} reason=already-running", key);
            return;
        }

        Instant lastRunTime = lastRunTimes.get(key);
        Duration interval = config.interval();
        if (!isDue(lastRunTime, interval, now)) {
            log.debug("scheduler not due key={} lastRunTime={} nextDueAt={}", key, lastRunTime, lastRunTime.plus(interval));
            return;
        }

        log.info("Scheduled job due key={} lastRunTime={} intervalMinutes={}",
                key, lastRunTime == null ? "never" : lastRunTime, config.intervalMinutes());
        dispatch(key, interval);
    }

    private void dispatch(JobKey key, Duration interval) {
        dispatchedIntervals.put(key, interval);
        CompletableFuture<JobExecution> future;
        try {
            future = batchManager.executeJob(key.userId(), key.jobType(), false);
        } catch (LockConflictException e) {
            dispatchedIntervals.remove(key, interval);
            log.debug("scheduler dispatch skipped key={} reason=lock-held runId={}", key, e.getRunId());
            return;
        } catch (BatchException e) {
            dispatchedIntervals.remove(key, interval);
            applyFailureCooldown(key, interval, clock.instant());
            log.error("scheduler dispatch failed key={} msg={}", key, e.getMessage(), e);
            return;
        }

        future.whenComplete((execution, error) -> {
            if (error == null) {
                log.info("Scheduled job completed key={} runId={} itemsChecked={} itemsUpdated={}",
                        key, execution.runId(), execution.result().itemsChecked(), execution.result().itemsUpdated());
                return;
            }
            Throwable cause = (error instanceof CompletionException && error.getCause() != null) ? error.getCause() : error;
            log.warn("Scheduled job failed key={} retryIn={} msg={}", key, props.getFailureCooldown(), cause.getMessage());
        });
    }

    /**
     * Record a failed scheduled run so the job is due again {@code failureCooldown} after the failure
     * instead of a full interval. Called by {@link BatchManager} before the run's lock is released.
     */
    public void recordFailure(String userId, String jobType, Instant failedAt) {
        JobKey key = new JobKey(userId, jobType);
        Duration interval = dispatchedIntervals.remove(key);
        if (interval == null) {
            return;
        }
        applyFailureCooldown(key, interval, failedAt);
        log.debug("scheduler applied failure cooldown key={} nextDueAt={}", key, failedAt.plus(props.getFailureCooldown()));
    }

    private void applyFailureCooldown(JobKey key, Duration interval, Instant failedAt) {
        lastRunTimes.put(key, failedAt.minus(interval).plus(props.getFailureCooldown()));
    }

    /**
     * Record a confirmed successful run. Called by {@link BatchManager} only.
     */
    public void updateLastRunTime(String userId, String jobType, Instant completedAt) {
        JobKey key = new JobKey(userId, jobType);
        dispatchedIntervals.remove(key);
        lastRunTimes.put(key, completedAt);
        log.debug("scheduler updated last run time key={} at={}", key, completedAt);
    }

    public Instant getLastRunTime(String userId, String jobType) {
        return lastRunTimes.get(new JobKey(userId, jobType));
    }

    public SchedulerStatus getStatus() {
        Map<String, Instant> times = new TreeMap<>();
        lastRunTimes.forEach((key, at) -> times.put(key.toString(), at));
        return new SchedulerStatus(started.get(), initialized, props.getCheckInterval(), times);
    }

    private static Instant laterOf(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
