package io.dockpulse.internal;

import io.dockpulse.JobResult;
import io.dockpulse.config.BatchProperties;
import io.dockpulse.core.DueResult;
import io.dockpulse.core.Intent;
import io.dockpulse.core.IntentEvaluatorStatus;
import io.dockpulse.core.IntentExecutionResult;
import io.dockpulse.core.IntentTrigger;
import io.dockpulse.core.ScanCompletionListener;
import io.dockpulse.core.ScheduleEvaluator;
import io.dockpulse.core.TriggerType;
import io.dockpulse.spi.IntentExecutor;
import io.dockpulse.spi.IntentStore;
import io.dockpulse.spi.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives intent execution on two paths: a cron poller for SCHEDULED intents, and scan-completion
 * events for IMMEDIATE intents.
 *
 * <p>An intent id is never dispatched twice concurrently in one process. For scheduled intents the
 * cron boundary is consumed (advance-only {@code lastEvaluatedAt} update) before the collaborator runs.
 */
public class IntentEvaluator implements ScanCompletionListener {
    private static final Logger log = LoggerFactory.getLogger(IntentEvaluator.class);

    private final IntentStore intentStore;
    private final UserDirectory userDirectory;
    private final ScheduleEvaluator scheduleEvaluator;
    private final IntentExecutor intentExecutor;
    private final ScanCompletionBus scanEvents;
    private final BatchProperties props;
    private final Clock clock;

    private final Set<String> inProgress = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private final Executor injectedExecutor;
    private ExecutorService workerPool;
    private ScheduledExecutorService ticker;

    public IntentEvaluator(IntentStore intentStore,
                           UserDirectory userDirectory,
                           ScheduleEvaluator scheduleEvaluator,
                           IntentExecutor intentExecutor,
                           ScanCompletionBus scanEvents,
                           BatchProperties props,
                           Clock clock) {
        this(intentStore, userDirectory, scheduleEvaluator, intentExecutor, scanEvents, props, clock, null);
    }

    /**
     * @param executor runs intent executions; when null a fixed pool of {@code intentConcurrency}
     *                 daemon threads is created on first use
     */
    public IntentEvaluator(IntentStore intentStore,
                           UserDirectory userDirectory,
                           ScheduleEvaluator scheduleEvaluator,
                           IntentExecutor intentExecutor,
                           ScanCompletionBus scanEvents,
                           BatchProperties props,
                           Clock clock,
                           Executor executor) {
        this.intentStore = Objects.requireNonNull(intentStore, "intentStore must not be null");
        this.userDirectory = Objects.requireNonNull(userDirectory, "userDirectory must not be null");
        this.scheduleEvaluator = Objects.requireNonNull(scheduleEvaluator, "scheduleEvaluator must not be null");
        this.intentExecutor = Objects.requireNonNull(intentExecutor, "intentExecutor must not be null");
        this.scanEvents = Objects.requireNonNull(scanEvents, "scanEvents must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.injectedExecutor = executor;
    }

    /**
     * Subscribe to scan completions and start the cron poller. Should be idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getIntentCheckInterval(), "dockpulse.intentCheckInterval must not be null");
        Duration startupDelay = Objects.requireNonNull(props.getIntentStartupDelay(), "dockpulse.intentStartupDelay must not be null");

        scanEvents.subscribe(this);

        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("dockpulse.intents");
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleWithFixedDelay(this::tick, startupDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("IntentEvaluator started intentCheckInterval={} startupDelay={} zone={}",
                interval, startupDelay, scheduleEvaluator.zone());
    }

    /**
     * Should be idempotent. Executions already handed to the pool are allowed to finish.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        scanEvents.unsubscribe(this);
        if (ticker != null) {
            ticker.shutdownNow();
            ticker = null;
        }

        ExecutorService pool;
        synchronized (this) {
            pool = workerPool;
            workerPool = null;
        }
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("IntentEvaluator pool did not drain within {}, interrupting inProgress={}",
                            props.getShutdownTimeout(), inProgress);
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            }
        }
        log.info("IntentEvaluator stopped");
    }

    public boolean isRunning() {
        return started.get();
    }

    private void tick() {
        try {
            checkScheduledIntents();
        } catch (Exception e) {
            log.error("intent check failed msg={}", e.getMessage(), e);
        }
    }

    /**
     * One polling pass over every user's enabled SCHEDULED intents.
     */
    public void checkScheduledIntents() {
        List<String> users = userDirectory.findAllUserIds();
        Instant now = clock.instant();
        log.debug("intent check now={} users={}", now, users.size());

        for (String userId : users) {
            List<Intent> intents;
            try {
                intents = intentStore.findEnabledIntents(userId);
            } catch (RuntimeException e) {
                log.error("intent check failed to load intents userId={} msg={}", userId, e.getMessage(), e);
                continue;
            }

            for (Intent intent : intents) {
                if (!intent.isScheduled()) {
                    continue;
                }
                try {
                    checkIntent(intent, userId, now);
                } catch (RuntimeException e) {
                    log.error("intent check failed intentId={} userId={} msg={}", intent.id(), userId, e.getMessage(), e);
                }
            }
        }
    }

    private void checkIntent(Intent intent, String userId, Instant now) {
        if (inProgress.contains(intent.id())) {
            log.debug("intent skip intentId={} reason=in-progress", intent.id());
            return;
        }

        DueResult due = scheduleEvaluator.isDue(intent, now);
        if (!due.due()) {
            log.debug("intent not due intentId={} reason={} nextRun={}", intent.id(), due.reason(), due.nextRun());
            return;
        }

        log.info("Scheduled intent due intentId={} name={} userId={} triggerTime={}",
                intent.id(), intent.name(), userId, due.triggerTime());
        dispatch(intent, userId, IntentTrigger.scheduledWindow(due.triggerTime()));
    }

    @Override
    public void onScanCompleted(String userId, String jobType, JobResult result) {
        log.debug("intent scan completion userId={} jobType={} itemsUpdated={}", userId, jobType, result.itemsUpdated());
        evaluateImmediateIntents(userId, result);
    }

    /**
     * Dispatch every enabled IMMEDIATE intent of the user. No-op unless the scan found updates.
     */
    public void evaluateImmediateIntents(String userId, JobResult scanResult) {
        if (scanResult == null || !scanResult.hasUpdates()) {
            return;
        }

        List<Intent> intents;
        try {
            intents = intentStore.findEnabledIntents(userId);
        } catch (RuntimeException e) {
            log.error("immediate intent lookup failed userId={} msg={}", userId, e.getMessage(), e);
            return;
        }

        Instant detectedAt = clock.instant();
        for (Intent intent : intents) {
            if (!intent.isImmediate()) {
                continue;
            }
            log.info("Immediate intent triggered intentId={} name={} userId={} itemsUpdated={}",
                    intent.id(), intent.name(), userId, scanResult.itemsUpdated());
            try {
                dispatch(intent, userId, IntentTrigger.scanDetected(detectedAt));
            } catch (RuntimeException e) {
                log.error("immediate intent dispatch failed intentId={} msg={}", intent.id(), e.getMessage(), e);
            }
        }
    }

    private void dispatch(Intent intent, String userId, IntentTrigger trigger) {
        if (!inProgress.add(intent.id())) {
            log.debug("intent skip intentId={} reason=in-progress trigger={}", intent.id(), trigger.type());
            return;
        }
        try {
            executor().execute(() -> runIntent(intent, userId, trigger));
        } catch (RejectedExecutionException e) {
            inProgress.remove(intent.id());
            log.error("intent execution rejected intentId={} msg={}", intent.id(), e.getMessage(), e);
        }
    }

    private void runIntent(Intent intent, String userId, IntentTrigger trigger) {
        try {
            if (trigger.type() == TriggerType.SCHEDULED_WINDOW && !consumeBoundary(intent, trigger)) {
                return;
            }

            String executionId;
            try {
                executionId = intentStore.createExecution(intent.id(), userId, trigger.type(), clock.instant());
            } catch (RuntimeException e) {
                log.error("intent createExecution failed intentId={} msg={}", intent.id(), e.getMessage(), e);
                return;
            }

            log.info("Intent execution started intentId={} executionId={} trigger={} triggerTime={}",
                    intent.id(), executionId, trigger.type().code(), trigger.triggerTime());

            IntentExecutionResult result;
            try {
                result = intentExecutor.execute(intent, userId, trigger);
                if (result == null) {
                    result = IntentExecutionResult.nothingMatched();
                }
            } catch (Exception | Error e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("intent execution failed intentId={} executionId={} msg={}", intent.id(), executionId, message, e);
                try {
                    intentStore.failExecution(executionId, message, clock.instant());
                } catch (RuntimeException storeEx) {
                    log.error("intent failExecution failed executionId={} msg={}", executionId, storeEx.getMessage(), storeEx);
                }
                if (e instanceof VirtualMachineError fatal) {
                    throw fatal;
                }
                return;
            }

            try {
                intentStore.completeExecution(executionId, result, clock.instant());
            } catch (RuntimeException e) {
                log.error("intent completeExecution failed executionId={} msg={}", executionId, e.getMessage(), e);
            }
            log.info("Intent execution finished intentId={} executionId={} status={} matched={} upgraded={} failed={} skipped={}",
                    intent.id(), executionId, result.status(), result.containersMatched(),
                    result.containersUpgraded(), result.containersFailed(), result.containersSkipped());
        } finally {
            inProgress.remove(intent.id());
        }
    }

    // Another instance may have taken the same boundary; only the one that moves the marker runs.
    private boolean consumeBoundary(Intent intent, IntentTrigger trigger) {
        boolean claimed;
        try {
            claimed = intentStore.markEvaluated(intent.id(), trigger.triggerTime());
        } catch (RuntimeException e) {
            log.error("intent markEvaluated failed intentId={} triggerTime={} msg={}",
                    intent.id(), trigger.triggerTime(), e.getMessage(), e);
            return false;
        }
        if (!claimed) {
            log.debug("intent skip intentId={} reason=boundary-already-consumed triggerTime={}",
                    intent.id(), trigger.triggerTime());
        }
        return claimed;
    }

    private synchronized Executor executor() {
        if (injectedExecutor != null) {
            return injectedExecutor;
        }
        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getIntentConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("dockpulse.intent-worker");
                t.setDaemon(true);
                return t;
            });
        }
        return workerPool;
    }

    public boolean isInProgress(String intentId) {
        return inProgress.contains(intentId);
    }

    public IntentEvaluatorStatus getStatus() {
        return new IntentEvaluatorStatus(started.get(), props.getIntentCheckInterval(), new TreeSet<>(inProgress));
    }
}
