package io.dockpulse.internal.mongo;

import io.dockpulse.core.BatchRunStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for batch runs. A document with status RUNNING is the persisted lock for its
 * (userId, jobType) pair.
 */
@Document(collection = "batch_runs")
public class BatchRunDocument {

    @Id
    private String id;

    private String userId;
    private String jobType;
    private BatchRunStatus status;
    private boolean manual;
    private Instant startedAt;

    @Field(write = Field.Write.ALWAYS)
    private Instant completedAt;

    private Long durationMs;
    private long itemsChecked;
    private long itemsUpdated;
    private String partialReason;
    private String errorMessage;
    private String logs;

    public BatchRunDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getJobType() {
        return jobType;
    }

    public void setJobType(String jobType) {
        this.jobType = jobType;
    }

    public BatchRunStatus getStatus() {
        return status;
    }

    public void setStatus(BatchRunStatus status) {
        this.status = status;
    }

    public boolean isManual() {
        return manual;
    }

    public void setManual(boolean manual) {
        this.manual = manual;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }

    public long getItemsChecked() {
        return itemsChecked;
    }

    public void setItemsChecked(long itemsChecked) {
        this.itemsChecked = itemsChecked;
    }

    public long getItemsUpdated() {
        return itemsUpdated;
    }

    public void setItemsUpdated(long itemsUpdated) {
        this.itemsUpdated = itemsUpdated;
    }

    public String getPartialReason() {
        return partialReason;
    }

    public void setPartialReason(String partialReason) {
        this.partialReason = partialReason;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getLogs() {
        return logs;
    }

    public void setLogs(String logs) {
        this.logs = logs;
    }
}
