package io.dockpulse.support;

import io.dockpulse.core.Intent;
import io.dockpulse.core.IntentExecutionResult;
import io.dockpulse.core.IntentExecutionStatus;
import io.dockpulse.core.TriggerType;
import io.dockpulse.spi.IntentStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryIntentStore implements IntentStore {

    public record Execution(String id, String intentId, String userId, TriggerType triggerType,
                            IntentExecutionStatus status, IntentExecutionResult result, String errorMessage,
                            Instant startedAt, Instant completedAt) {
    }

    private final Map<String, Intent> intents = new LinkedHashMap<>();
    private final Map<String, Execution> executions = new LinkedHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();

    public synchronized void put(Intent intent) {
        intents.put(intent.id(), intent);
    }

    public synchronized Intent get(String intentId) {
        return intents.get(intentId);
    }

    public synchronized List<Execution> executions() {
        return new ArrayList<>(executions.values());
    }

    public synchronized void putExecution(Execution execution) {
        executions.put(execution.id(), execution);
    }

    @Override
    public synchronized List<Intent> findEnabledIntents(String userId) {
        return intents.values().stream()
                .filter(i -> i.enabled() && i.userId().equals(userId))
                .toList();
    }

    @Override
    public synchronized boolean markEvaluated(String intentId, Instant evaluatedAt) {
        Intent intent = intents.get(intentId);
        if (intent == null) {
            return false;
        }
        if (intent.lastEvaluatedAt() != null && !intent.lastEvaluatedAt().isBefore(evaluatedAt)) {
            return false;
        }
        intents.put(intentId, intent.withLastEvaluatedAt(evaluatedAt));
        return true;
    }

    @Override
    public synchronized String createExecution(String intentId, String userId, TriggerType triggerType, Instant startedAt) {
        String id = "exec-" + sequence.incrementAndGet();
        executions.put(id, new Execution(id, intentId, userId, triggerType, IntentExecutionStatus.RUNNING,
                null, null, startedAt, null));
        return id;
    }

    @Override
    public synchronized void completeExecution(String executionId, IntentExecutionResult result, Instant completedAt) {
        Execution e = executions.get(executionId);
        executions.put(executionId, new Execution(e.id(), e.intentId(), e.userId(), e.triggerType(), result.status(),
                result, null, e.startedAt(), completedAt));
    }

    @Override
    public synchronized void failExecution(String executionId, String errorMessage, Instant completedAt) {
        Execution e = executions.get(executionId);
        executions.put(executionId, new Execution(e.id(), e.intentId(), e.userId(), e.triggerType(),
                IntentExecutionStatus.FAILED, null, errorMessage, e.startedAt(), completedAt));
    }

    @Override
    public synchronized int failStaleExecutions(String reason, Instant now) {
        List<Execution> running = executions.values().stream()
                .filter(e -> e.status() == IntentExecutionStatus.RUNNING)
                .toList();
        running.forEach(e -> failExecution(e.id(), reason, now));
        return running.size();
    }
}
