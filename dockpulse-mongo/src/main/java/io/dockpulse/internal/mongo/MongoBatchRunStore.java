package io.dockpulse.internal.mongo;

import io.dockpulse.JobResult;
import io.dockpulse.core.BatchRun;
import io.dockpulse.core.BatchRunStatus;
import io.dockpulse.core.LockCheck;
import io.dockpulse.core.LockConflictException;
import io.dockpulse.core.PersistenceException;
import io.dockpulse.spi.BatchRunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * MongoDB persistence for batch runs.
 *
 * <p>Lock semantics:
 * <ul>
 *   <li>At most one RUNNING document per (userId, jobType), enforced by the unique partial index
 *       {@code ux_running_user_job}; losing an insert race surfaces as {@link LockConflictException}</li>
 *   <li>Terminal updates only apply to documents that are still RUNNING, so a run force-failed as stale
 *       is never resurrected by its late finisher</li>
 * </ul>
 */
public class MongoBatchRunStore implements BatchRunStore {
    private static final Logger log = LoggerFactory.getLogger(MongoBatchRunStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoBatchRunStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public LockCheck checkLock(String userId, String jobType, Duration staleAfter, Instant now) {
        Objects.requireNonNull(staleAfter, "staleAfter must not be null");
        Objects.requireNonNull(now, "now must not be null");

        return persist("checkLock", () -> {
            BatchRunDocument running = mongoTemplate.findOne(runningQuery(userId, jobType), BatchRunDocument.class);
            if (running == null) {
                return LockCheck.free();
            }
            if (running.getStartedAt() != null && !running.getStartedAt().isBefore(now.minus(staleAfter))) {
                return LockCheck.heldBy(running.getId());
            }

            Query q = new Query(Criteria.where("_id").is(running.getId()).and("status").is(BatchRunStatus.RUNNING));
            Update u = terminal(BatchRunStatus.FAILED, running.getStartedAt(), now)
                    .set("errorMessage", "Job was interrupted (running longer than " + staleAfter + ")");
            BatchRunDocument released = mongoTemplate.findAndModify(q, u, FindAndModifyOptions.options().returnNew(true),
                    BatchRunDocument.class);
            if (released == null) {
                // finished between the read and the update
                BatchRunDocument current = mongoTemplate.findOne(runningQuery(userId, jobType), BatchRunDocument.class);
                return current == null ? LockCheck.free() : LockCheck.heldBy(current.getId());
            }
            log.warn("batch stale run released runId={} userId={} jobType={} startedAt={}",
                    running.getId(), userId, jobType, running.getStartedAt());
            return LockCheck.releasedStale(running.getId());
        });
    }

    @Override
    public BatchRun createRun(String userId, String jobType, boolean manual, Instant startedAt) {
        BatchRunDocument doc = new BatchRunDocument();
        doc.setUserId(userId);
        doc.setJobType(jobType);
        doc.setStatus(BatchRunStatus.RUNNING);
        doc.setManual(manual);
        doc.setStartedAt(startedAt);

        try {
            return toRun(mongoTemplate.insert(doc));
        } catch (DuplicateKeyException e) {
            BatchRunDocument holder = mongoTemplate.findOne(runningQuery(userId, jobType), BatchRunDocument.class);
            throw new LockConflictException(userId, jobType, holder == null ? null : holder.getId());
        } catch (DataAccessException e) {
            throw new PersistenceException("createRun failed userId=" + userId + " jobType=" + jobType, e);
        }
    }

    @Override
    public void completeRun(String runId, JobResult result, String logs, Instant completedAt) {
        Objects.requireNonNull(result, "result must not be null");
        finish(runId, BatchRunStatus.COMPLETED, completedAt, u -> u
                .set("itemsChecked", result.itemsChecked())
                .set("itemsUpdated", result.itemsUpdated())
                .set("partialReason", result.partialReason())
                .set("logs", logs));
    }

    @Override
    public void failRun(String runId, String errorMessage, long itemsChecked, long itemsUpdated, String logs, Instant completedAt) {
        finish(runId, BatchRunStatus.FAILED, completedAt, u -> u
                .set("errorMessage", errorMessage)
                .set("itemsChecked", itemsChecked)
                .set("itemsUpdated", itemsUpdated)
                .set("logs", logs));
    }

    private void finish(String runId, BatchRunStatus status, Instant completedAt, UnaryOperator<Update> fields) {
        Objects.requireNonNull(runId, "runId must not be null");
        persist("finish", () -> {
            BatchRunDocument current = mongoTemplate.findById(runId, BatchRunDocument.class);
            if (current == null || current.getStatus() != BatchRunStatus.RUNNING) {
                log.warn("batch run is no longer RUNNING, outcome dropped runId={} status={} outcome={}",
                        runId, current == null ? "missing" : current.getStatus(), status);
                return null;
            }
            Query q = new Query(Criteria.where("_id").is(runId).and("status").is(BatchRunStatus.RUNNING));
            long modified = mongoTemplate.updateFirst(q, fields.apply(terminal(status, current.getStartedAt(), completedAt)),
                    BatchRunDocument.class).getModifiedCount();
            if (modified == 0) {
                log.warn("batch run changed state concurrently, outcome dropped runId={} outcome={}", runId, status);
            }
            return null;
        });
    }

    private static Update terminal(BatchRunStatus status, Instant startedAt, Instant completedAt) {
        Update u = new Update()
                .set("status", status)
                .set("completedAt", completedAt);
        if (startedAt != null) {
            u.set("durationMs", Duration.between(startedAt, completedAt).toMillis());
        }
        return u;
    }

    @Override
    public Optional<BatchRun> findById(String runId) {
        return persist("findById", () -> Optional.ofNullable(mongoTemplate.findById(runId, BatchRunDocument.class)).map(this::toRun));
    }

    @Override
    public Optional<BatchRun> findLatestCompleted(String userId, String jobType) {
        Query q = new Query(Criteria.where("userId").is(userId)
                .and("jobType").is(jobType)
                .and("status").is(BatchRunStatus.COMPLETED))
                .with(Sort.by(Sort.Direction.DESC, "completedAt"))
                .limit(1);
        return persist("findLatestCompleted", () -> Optional.ofNullable(mongoTemplate.findOne(q, BatchRunDocument.class)).map(this::toRun));
    }

    @Override
    public List<BatchRun> findRecent(String userId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = new Query(Criteria.where("userId").is(userId))
                .with(Sort.by(Sort.Direction.DESC, "startedAt"))
                .limit(limit);
        return persist("findRecent", () -> mongoTemplate.find(q, BatchRunDocument.class).stream().map(this::toRun).toList());
    }

    @Override
    public int failStaleRuns(String reason, Instant now) {
        Query q = new Query(Criteria.where("status").is(BatchRunStatus.RUNNING));
        Update u = new Update()
                .set("status", BatchRunStatus.FAILED)
                .set("completedAt", now)
                .set("errorMessage", reason);
        return persist("failStaleRuns", () -> (int) mongoTemplate.updateMulti(q, u, BatchRunDocument.class).getModifiedCount());
    }

    private static Query runningQuery(String userId, String jobType) {
        return new Query(Criteria.where("userId").is(userId)
                .and("jobType").is(jobType)
                .and("status").is(BatchRunStatus.RUNNING));
    }

    private BatchRun toRun(BatchRunDocument doc) {
        return new BatchRun(
                doc.getId(),
                doc.getUserId(),
                doc.getJobType(),
                doc.getStatus(),
                doc.isManual(),
                doc.getStartedAt(),
                doc.getCompletedAt(),
                doc.getDurationMs(),
                doc.getItemsChecked(),
                doc.getItemsUpdated(),
                doc.getPartialReason(),
                doc.getErrorMessage(),
                doc.getLogs()
        );
    }

    static <T> T persist(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new PersistenceException(operation + " failed: " + e.getMessage(), e);
        }
    }
}
