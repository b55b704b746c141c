package io.dockpulse.internal.mongo;

import io.dockpulse.core.BatchRunStatus;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;

import java.util.Objects;

/**
 * MongoDB index definitions for the batch engine.
 *
 * <p>{@link #runningLockIndex()} is required for correctness: it is what makes the RUNNING batch run a lock
 * across engine instances. The others serve the engine's queries.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>ux_running_user_job</b> (batch_runs, unique + partial): { userId: 1, jobType: 1 } with
 *       partialFilterExpression { status: "RUNNING" }</li>
 *   <li><b>idx_runs_latest_completed</b> (batch_runs): { userId: 1, jobType: 1, status: 1, completedAt: -1 }</li>
 *   <li><b>idx_runs_user_started</b> (batch_runs): { userId: 1, startedAt: -1 }</li>
 *   <li><b>ux_config_user_job</b> (batch_configs, unique): { userId: 1, jobType: 1 }</li>
 *   <li><b>idx_intents_user_enabled</b> (intents): { userId: 1, enabled: 1 }</li>
 *   <li><b>idx_executions_intent_started</b> (intent_executions): { intentId: 1, startedAt: -1 }</li>
 *   <li><b>idx_executions_status</b> (intent_executions): { status: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.batch_runs.createIndex(
 *   { userId: 1, jobType: 1 },
 *   { name: "ux_running_user_job", unique: true, partialFilterExpression: { status: "RUNNING" } }
 * );
 * db.batch_runs.createIndex({ userId: 1, jobType: 1, status: 1, completedAt: -1 }, { name: "idx_runs_latest_completed" });
 * db.batch_runs.createIndex({ userId: 1, startedAt: -1 }, { name: "idx_runs_user_started" });
 * db.batch_configs.createIndex({ userId: 1, jobType: 1 }, { name: "ux_config_user_job", unique: true });
 * db.intents.createIndex({ userId: 1, enabled: 1 }, { name: "idx_intents_user_enabled" });
 * db.intent_executions.createIndex({ intentId: 1, startedAt: -1 }, { name: "idx_executions_intent_started" });
 * db.intent_executions.createIndex({ status: 1 }, { name: "idx_executions_status" });
 * </pre>
 */
public class BatchMongoIndexConfig {

    public static final String UX_RUNNING_USER_JOB = "ux_running_user_job";
    public static final String IDX_RUNS_LATEST_COMPLETED = "idx_runs_latest_completed";
    public static final String IDX_RUNS_USER_STARTED = "idx_runs_user_started";
    public static final String UX_CONFIG_USER_JOB = "ux_config_user_job";
    public static final String IDX_INTENTS_USER_ENABLED = "idx_intents_user_enabled";
    public static final String IDX_EXECUTIONS_INTENT_STARTED = "idx_executions_intent_started";
    public static final String IDX_EXECUTIONS_STATUS = "idx_executions_status";

    private final MongoTemplate mongoTemplate;

    public BatchMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create every index above. Idempotent for unchanged definitions.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(BatchRunDocument.class).ensureIndex(runningLockIndex());
        mongoTemplate.indexOps(BatchRunDocument.class).ensureIndex(latestCompletedIndex());
        mongoTemplate.indexOps(BatchRunDocument.class).ensureIndex(userStartedIndex());
        mongoTemplate.indexOps(BatchConfigDocument.class).ensureIndex(configUserJobIndex());
        mongoTemplate.indexOps(IntentDocument.class).ensureIndex(intentsUserEnabledIndex());
        mongoTemplate.indexOps(IntentExecutionDocument.class).ensureIndex(executionsIntentStartedIndex());
        mongoTemplate.indexOps(IntentExecutionDocument.class).ensureIndex(executionsStatusIndex());
    }

    /**
     * At most one RUNNING run per (userId, jobType).
     */
    public static Index runningLockIndex() {
        return new Index()
                .on("userId", Sort.Direction.ASC)
                .on("jobType", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(new Document("status", BatchRunStatus.RUNNING.name())))
                .named(UX_RUNNING_USER_JOB);
    }

    public static Index latestCompletedIndex() {
        return new Index()
                .on("userId", Sort.Direction.ASC)
                .on("jobType", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .on("completedAt", Sort.Direction.DESC)
                .named(IDX_RUNS_LATEST_COMPLETED);
    }

    public static Index userStartedIndex() {
        return new Index()
                .on("userId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_RUNS_USER_STARTED);
    }

    public static Index configUserJobIndex() {
        return new Index()
                .on("userId", Sort.Direction.ASC)
                .on("jobType", Sort.Direction.ASC)
                .unique()
                .named(UX_CONFIG_USER_JOB);
    }

    public static Index intentsUserEnabledIndex() {
        return new Index()
                .on("userId", Sort.Direction.ASC)
                .on("enabled", Sort.Direction.ASC)
                .named(IDX_INTENTS_USER_ENABLED);
    }

    public static Index executionsIntentStartedIndex() {
        return new Index()
                .on("intentId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_EXECUTIONS_INTENT_STARTED);
    }

    public static Index executionsStatusIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .named(IDX_EXECUTIONS_STATUS);
    }
}
