package io.dockpulse.internal.mongo;

import io.dockpulse.core.ConfigurationException;
import io.dockpulse.core.Intent;
import io.dockpulse.core.IntentExecutionResult;
import io.dockpulse.core.IntentExecutionStatus;
import io.dockpulse.core.ScheduleEvaluator;
import io.dockpulse.core.ScheduleType;
import io.dockpulse.core.TriggerType;
import io.dockpulse.spi.IntentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.dockpulse.internal.mongo.MongoBatchRunStore.persist;

/**
 * MongoDB persistence for intents and their executions.
 *
 * <p>{@code lastEvaluatedAt} is written as {@code createdAt} on creation, reset to "now" when the schedule
 * changes, and otherwise only moved forward by {@link #markEvaluated(String, Instant)}.
 */
public class MongoIntentStore implements IntentStore {
    private static final Logger log = LoggerFactory.getLogger(MongoIntentStore.class);

    private final MongoTemplate mongoTemplate;
    private final ScheduleEvaluator scheduleEvaluator;
    private final Clock clock;

    public MongoIntentStore(MongoTemplate mongoTemplate, ScheduleEvaluator scheduleEvaluator, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.scheduleEvaluator = Objects.requireNonNull(scheduleEvaluator, "scheduleEvaluator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Persist a new intent. A SCHEDULED intent waits for the first cron boundary after its creation.
     *
     * @throws ConfigurationException when a SCHEDULED intent has a missing or invalid cron expression
     */
    public Intent create(String userId, String name, ScheduleType scheduleType, String scheduleCron, boolean enabled) {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(scheduleType, "scheduleType must not be null");
        Instant now = clock.instant();

        IntentDocument doc = new IntentDocument();
        doc.setUserId(userId);
        doc.setName(name);
        doc.setEnabled(enabled);
        doc.setScheduleType(scheduleType);
        doc.setScheduleCron(checkedCron(scheduleType, scheduleCron, now));
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        doc.setLastEvaluatedAt(now);

        return toIntent(persist("createIntent", () -> mongoTemplate.insert(doc)));
    }

    /**
     * Change how an intent is scheduled. The cron window restarts from now, so boundaries that passed under
     * the old schedule are not replayed.
     *
     * @return false when the intent does not exist
     */
    public boolean updateSchedule(String intentId, ScheduleType scheduleType, String scheduleCron) {
        Objects.requireNonNull(scheduleType, "scheduleType must not be null");
        Instant now = clock.instant();
        Update u = new Update()
                .set("scheduleType", scheduleType)
                .set("scheduleCron", checkedCron(scheduleType, scheduleCron, now))
                .set("lastEvaluatedAt", now)
                .set("updatedAt", now);
        return persist("updateSchedule", () -> mongoTemplate.updateFirst(byId(intentId), u, IntentDocument.class).getMatchedCount() == 1);
    }

    public boolean setEnabled(String intentId, boolean enabled) {
        Update u = new Update()
                .set("enabled", enabled)
                .set("updatedAt", clock.instant());
        return persist("setEnabled", () -> mongoTemplate.updateFirst(byId(intentId), u, IntentDocument.class).getMatchedCount() == 1);
    }

    private String checkedCron(ScheduleType scheduleType, String scheduleCron, Instant now) {
        if (scheduleType == ScheduleType.IMMEDIATE) {
            return null;
        }
        ScheduleEvaluator.CronValidation validation = scheduleEvaluator.validateCron(scheduleCron, now);
        if (!validation.valid()) {
            throw new ConfigurationException("Invalid cron expression '" + scheduleCron + "': " + validation.error());
        }
        return scheduleCron.trim();
    }

    public Optional<Intent> findById(String intentId) {
        return persist("findIntent", () -> Optional.ofNullable(mongoTemplate.findById(intentId, IntentDocument.class)).map(this::toIntent));
    }

    @Override
    public List<Intent> findEnabledIntents(String userId) {
        Query q = new Query(Criteria.where("userId").is(userId).and("enabled").is(true))
                .with(Sort.by(Sort.Direction.ASC, "createdAt"));
        return persist("findEnabledIntents", () -> mongoTemplate.find(q, IntentDocument.class).stream().map(this::toIntent).toList());
    }

    @Override
    public boolean markEvaluated(String intentId, Instant evaluatedAt) {
        Objects.requireNonNull(evaluatedAt, "evaluatedAt must not be null");
        Query q = new Query(Criteria.where("_id").is(intentId).orOperator(
                Criteria.where("lastEvaluatedAt").is(null),
                Criteria.where("lastEvaluatedAt").lt(evaluatedAt)
        ));
        Update u = new Update().set("lastEvaluatedAt", evaluatedAt);
        return persist("markEvaluated", () -> mongoTemplate.updateFirst(q, u, IntentDocument.class).getModifiedCount() == 1);
    }

    @Override
    public String createExecution(String intentId, String userId, TriggerType triggerType, Instant startedAt) {
        IntentExecutionDocument doc = new IntentExecutionDocument();
        doc.setIntentId(intentId);
        doc.setUserId(userId);
        doc.setTriggerType(triggerType);
        doc.setStatus(IntentExecutionStatus.RUNNING);
        doc.setStartedAt(startedAt);
        return persist("createExecution", () -> mongoTemplate.insert(doc).getId());
    }

    @Override
    public void completeExecution(String executionId, IntentExecutionResult result, Instant completedAt) {
        Objects.requireNonNull(result, "result must not be null");
        finishExecution(executionId, result.status(), completedAt, new Update()
                .set("containersMatched", result.containersMatched())
                .set("containersUpgraded", result.containersUpgraded())
                .set("containersFailed", result.containersFailed())
                .set("containersSkipped", result.containersSkipped()));
    }

    @Override
    public void failExecution(String executionId, String errorMessage, Instant completedAt) {
        finishExecution(executionId, IntentExecutionStatus.FAILED, completedAt, new Update().set("errorMessage", errorMessage));
    }

    private void finishExecution(String executionId, IntentExecutionStatus status, Instant completedAt, Update u) {
        persist("finishExecution", () -> {
            IntentExecutionDocument current = mongoTemplate.findById(executionId, IntentExecutionDocument.class);
            if (current == null || current.getStatus() != IntentExecutionStatus.RUNNING) {
                log.warn("intent execution is no longer RUNNING, outcome dropped executionId={} outcome={}", executionId, status);
                return null;
            }
            u.set("status", status).set("completedAt", completedAt);
            if (current.getStartedAt() != null) {
                u.set("durationMs", Duration.between(current.getStartedAt(), completedAt).toMillis());
            }
            Query q = new Query(Criteria.where("_id").is(executionId).and("status").is(IntentExecutionStatus.RUNNING));
            mongoTemplate.updateFirst(q, u, IntentExecutionDocument.class);
            return null;
        });
    }

    @Override
    public int failStaleExecutions(String reason, Instant now) {
        Query q = new Query(Criteria.where("status").is(IntentExecutionStatus.RUNNING));
        Update u = new Update()
                .set("status", IntentExecutionStatus.FAILED)
                .set("completedAt", now)
                .set("errorMessage", reason);
        return persist("failStaleExecutions", () -> (int) mongoTemplate.updateMulti(q, u, IntentExecutionDocument.class).getModifiedCount());
    }

    /**
     * Execution history of one intent, newest first.
     */
    public List<IntentExecutionDocument> findRecentExecutions(String intentId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = new Query(Criteria.where("intentId").is(intentId))
                .with(Sort.by(Sort.Direction.DESC, "startedAt"))
                .limit(limit);
        return persist("findRecentExecutions", () -> mongoTemplate.find(q, IntentExecutionDocument.class));
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private Intent toIntent(IntentDocument doc) {
        return new Intent(
                doc.getId(),
                doc.getUserId(),
                doc.getName(),
                doc.isEnabled(),
                doc.getScheduleType(),
                doc.getScheduleCron(),
                doc.getLastEvaluatedAt(),
                doc.getCreatedAt()
        );
    }
}
