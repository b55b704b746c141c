package io.dockpulse.internal.mongo;

import io.dockpulse.core.IntentExecutionStatus;
import io.dockpulse.core.TriggerType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One execution attempt of an intent.
 */
@Document(collection = "intent_executions")
public class IntentExecutionDocument {

    @Id
    private String id;

    private String intentId;
    private String userId;
    private TriggerType triggerType;
    private IntentExecutionStatus status;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private int containersMatched;
    private int containersUpgraded;
    private int containersFailed;
    private int containersSkipped;
    private String errorMessage;

    public IntentExecutionDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getIntentId() {
        return intentId;
    }

    public void setIntentId(String intentId) {
        this.intentId = intentId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public TriggerType getTriggerType() {
        return triggerType;
    }

    public void setTriggerType(TriggerType triggerType) {
        this.triggerType = triggerType;
    }

    public IntentExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(IntentExecutionStatus status) {
        this.status = status;
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

    public int getContainersMatched() {
        return containersMatched;
    }

    public void setContainersMatched(int containersMatched) {
        this.containersMatched = containersMatched;
    }

    public int getContainersUpgraded() {
        return containersUpgraded;
    }

    public void setContainersUpgraded(int containersUpgraded) {
        this.containersUpgraded = containersUpgraded;
    }

    public int getContainersFailed() {
        return containersFailed;
    }

    public void setContainersFailed(int containersFailed) {
        this.containersFailed = containersFailed;
    }

    public int getContainersSkipped() {
        return containersSkipped;
    }

    public void setContainersSkipped(int containersSkipped) {
        this.containersSkipped = containersSkipped;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }
}
