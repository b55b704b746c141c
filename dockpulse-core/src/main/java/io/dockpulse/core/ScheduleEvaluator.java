package io.dockpulse.core;

import io.dockpulse.utils.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Cron due-ness for scheduled intents. Stateless; callers act on the returned {@link DueResult}.
 *
 * <p>Core invariant: after acting on a due result the caller stores {@link DueResult#triggerTime()} (the
 * cron boundary, not wall-clock time) as the intent's {@code lastEvaluatedAt}. A boundary therefore fires
 * at most once, missed boundaries are replayed one per check, and an intent created with
 * {@code lastEvaluatedAt = createdAt} waits for its first real boundary.
 */
public class ScheduleEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ScheduleEvaluator.class);

    private static final Duration[] LOOKBACK_WINDOWS = {
            Duration.ofHours(1),
            Duration.ofDays(1),
            Duration.ofDays(31),
            Duration.ofDays(366)
    };
    private static final int MAX_LOOKBACK_STEPS = 100_000;

    private final ZoneId zone;

    public ScheduleEvaluator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ScheduleEvaluator() {
        this(ZoneId.of("UTC"));
    }

    public ZoneId zone() {
        return zone;
    }

    public record CronValidation(boolean valid, String error, Instant nextRun) {
    }

    public CronValidation validateCron(String cronExpression, Instant now) {
        if (cronExpression == null || cronExpression.isBlank()) {
            return new CronValidation(false, "cron expression is empty", null);
        }
        try {
            Instant next = CronSchedules.nextAfter(cronExpression, zone, now);
            return new CronValidation(true, null, next);
        } catch (IllegalArgumentException ex) {
            return new CronValidation(false, ex.getMessage(), null);
        }
    }

    /**
     * Next trigger strictly after {@code from}; null when the expression is invalid or exhausted.
     */
    public Instant nextRun(String cronExpression, Instant from) {
        try {
            return CronSchedules.nextAfter(cronExpression, zone, from);
        } catch (IllegalArgumentException ex) {
            log.error("cron next-run computation failed cron={} msg={}", cronExpression, ex.getMessage());
            return null;
        }
    }

    /**
     * Most recent trigger strictly before {@code before}, searched up to one year back. Null when there is
     * none in that range or the expression is invalid.
     */
    public Instant previousRun(String cronExpression, Instant before) {
        Objects.requireNonNull(before, "before must not be null");
        if (!validateCron(cronExpression, before).valid()) {
            return null;
        }
        for (Duration window : LOOKBACK_WINDOWS) {
            Instant cursor = before.minus(window);
            Instant last = null;
            for (int i = 0; i < MAX_LOOKBACK_STEPS; i++) {
                Instant next = CronSchedules.nextAfter(cronExpression, zone, cursor);
                if (next == null || !next.isBefore(before)) {
                    break;
                }
                last = next;
                cursor = next;
            }
            if (last != null) {
                return last;
            }
        }
        return null;
    }

    public String describe(String cronExpression, Instant now) {
        CronValidation validation = validateCron(cronExpression, now);
        if (!validation.valid()) {
            return "Invalid cron expression";
        }
        return validation.nextRun() != null ? "Next run: " + validation.nextRun() : "No upcoming runs";
    }

    /**
     * Decide whether an intent is due at {@code now}.
     *
     * <ul>
     *   <li>IMMEDIATE intents are never due here; scans drive them.</li>
     *   <li>Missing or invalid cron: not due, the reason says why.</li>
     *   <li>Missing lastEvaluatedAt (legacy rows): due now, with a warning.</li>
     *   <li>Otherwise due iff the first boundary after lastEvaluatedAt is at or before now.</li>
     * </ul>
     */
    public DueResult isDue(Intent intent, Instant now) {
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (intent.isImmediate()) {
            return DueResult.notDue(null, "immediate schedule type");
        }

        String cron = intent.scheduleCron();
        if (cron == null || cron.isBlank()) {
            return DueResult.notDue(null, "no cron expression");
        }

        CronValidation validation = validateCron(cron, now);
        if (!validation.valid()) {
            return DueResult.notDue(null, "invalid cron: " + validation.error());
        }
        Instant nextRun = validation.nextRun();

        Instant lastEvaluatedAt = intent.lastEvaluatedAt();
        if (lastEvaluatedAt == null) {
            log.warn("intent missing lastEvaluatedAt, treating as due (legacy data) intentId={} name={}",
                    intent.id(), intent.name());
            return DueResult.dueAt(now, nextRun, "missing lastEvaluatedAt (legacy)");
        }

        Instant nextAfterLastEval = CronSchedules.nextAfter(cron, zone, lastEvaluatedAt);

        log.debug("intent due check intentId={} cron={} now={} lastEvaluatedAt={} nextAfterLastEval={} nextRun={}",
                intent.id(), cron, now, lastEvaluatedAt, nextAfterLastEval, nextRun);

        if (nextAfterLastEval != null && !nextAfterLastEval.isAfter(now)) {
            return DueResult.dueAt(nextAfterLastEval, nextRun, "cron triggered at " + nextAfterLastEval);
        }
        return DueResult.notDue(nextRun, "not yet due");
    }
}
