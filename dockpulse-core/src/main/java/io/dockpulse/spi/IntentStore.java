package io.dockpulse.spi;

import io.dockpulse.core.Intent;
import io.dockpulse.core.IntentExecutionResult;
import io.dockpulse.core.TriggerType;

import java.time.Instant;
import java.util.List;

/**
 * Intents and their execution history.
 */
public interface IntentStore {

    List<Intent> findEnabledIntents(String userId);

    /**
     * Advance {@code lastEvaluatedAt} to {@code evaluatedAt} unless it is already at or past it.
     *
     * @return true when this call moved the marker; false when the boundary was already consumed
     */
    boolean markEvaluated(String intentId, Instant evaluatedAt);

    /**
     * Record a RUNNING execution.
     *
     * @return execution id
     */
    String createExecution(String intentId, String userId, TriggerType triggerType, Instant startedAt);

    void completeExecution(String executionId, IntentExecutionResult result, Instant completedAt);

    void failExecution(String executionId, String errorMessage, Instant completedAt);

    /**
     * Force every RUNNING execution to FAILED. Used on startup.
     *
     * @return number of executions updated
     */
    int failStaleExecutions(String reason, Instant now);
}
