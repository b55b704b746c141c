package io.dockpulse.internal.mongo;

import com.mongodb.client.MongoClients;
import io.dockpulse.core.ConfigurationException;
import io.dockpulse.core.Intent;
import io.dockpulse.core.IntentExecutionResult;
import io.dockpulse.core.IntentExecutionStatus;
import io.dockpulse.core.ScheduleEvaluator;
import io.dockpulse.core.ScheduleType;
import io.dockpulse.core.TriggerType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoIntentStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant T0 = Instant.parse("2026-01-01T10:02:00Z");

    private MongoTemplate mongoTemplate;
    private MongoIntentStore intentStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "dockpulse_test");
        mongoTemplate.dropCollection(IntentDocument.class);
        mongoTemplate.dropCollection(IntentExecutionDocument.class);
        intentStore = new MongoIntentStore(mongoTemplate, new ScheduleEvaluator(), Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(IntentDocument.class);
        mongoTemplate.dropCollection(IntentExecutionDocument.class);
    }

    @Test
    void createStartsEvaluationWindowAtCreation() {
        Intent intent = intentStore.create("user-1", "nightly", ScheduleType.SCHEDULED, " 0 3 * * * ", true);

        assertEquals(T0, intent.lastEvaluatedAt());
        assertEquals(T0, intent.createdAt());
        assertEquals("0 3 * * *", intent.scheduleCron());
        assertFalse(new ScheduleEvaluator().isDue(intent, T0.plusSeconds(60)).due());
    }

    @Test
    void createRejectsMissingOrInvalidCron() {
        assertThrows(ConfigurationException.class,
                () -> intentStore.create("user-1", "broken", ScheduleType.SCHEDULED, "every day", true));
        assertThrows(ConfigurationException.class,
                () -> intentStore.create("user-1", "broken", ScheduleType.SCHEDULED, null, true));

        Intent immediate = intentStore.create("user-1", "on-scan", ScheduleType.IMMEDIATE, "ignored", true);
        assertNull(immediate.scheduleCron());
    }

    @Test
    void markEvaluatedOnlyMovesForward() {
        Intent intent = intentStore.create("user-1", "hourly", ScheduleType.SCHEDULED, "0 * * * *", true);
        Instant boundary = Instant.parse("2026-01-01T11:00:00Z");

        assertTrue(intentStore.markEvaluated(intent.id(), boundary));
        assertFalse(intentStore.markEvaluated(intent.id(), boundary));
        assertFalse(intentStore.markEvaluated(intent.id(), Instant.parse("2026-01-01T10:30:00Z")));
        assertTrue(intentStore.markEvaluated(intent.id(), Instant.parse("2026-01-01T12:00:00Z")));

        assertEquals(Instant.parse("2026-01-01T12:00:00Z"), intentStore.findById(intent.id()).orElseThrow().lastEvaluatedAt());
    }

    @Test
    void findEnabledIntentsSkipsDisabledAndOtherUsers() {
        Intent kept = intentStore.create("user-1", "a", ScheduleType.IMMEDIATE, null, true);
        Intent disabled = intentStore.create("user-1", "b", ScheduleType.IMMEDIATE, null, true);
        intentStore.create("user-2", "c", ScheduleType.IMMEDIATE, null, true);
        assertTrue(intentStore.setEnabled(disabled.id(), false));

        List<Intent> intents = intentStore.findEnabledIntents("user-1");

        assertEquals(1, intents.size());
        assertEquals(kept.id(), intents.get(0).id());
    }

    @Test
    void updateScheduleRestartsWindow() {
        MongoIntentStore later = new MongoIntentStore(mongoTemplate, new ScheduleEvaluator(),
                Clock.fixed(T0.plusSeconds(3600), ZoneOffset.UTC));
        Intent intent = intentStore.create("user-1", "on-scan", ScheduleType.IMMEDIATE, null, true);

        assertTrue(later.updateSchedule(intent.id(), ScheduleType.SCHEDULED, "*/5 * * * *"));
        assertThrows(ConfigurationException.class, () -> later.updateSchedule(intent.id(), ScheduleType.SCHEDULED, "nope"));
        assertFalse(later.updateSchedule("000000000000000000000000", ScheduleType.IMMEDIATE, null));

        Intent updated = intentStore.findById(intent.id()).orElseThrow();
        assertEquals(ScheduleType.SCHEDULED, updated.scheduleType());
        assertEquals(T0.plusSeconds(3600), updated.lastEvaluatedAt());
    }

    @Test
    void executionLifecycleAndStartupSweep() {
        String done = intentStore.createExecution("intent-1", "user-1", TriggerType.SCHEDULED_WINDOW, T0);
        String failed = intentStore.createExecution("intent-1", "user-1", TriggerType.SCAN_DETECTED, T0.plusSeconds(60));
        String orphan = intentStore.createExecution("intent-1", "user-1", TriggerType.SCAN_DETECTED, T0.plusSeconds(120));

        intentStore.completeExecution(done, new IntentExecutionResult(IntentExecutionStatus.PARTIAL, 4, 2, 1, 1), T0.plusSeconds(30));
        intentStore.failExecution(failed, "portainer unreachable", T0.plusSeconds(61));
        assertEquals(1, intentStore.failStaleExecutions("Intent execution was interrupted (server restart detected)", T0.plusSeconds(200)));

        List<IntentExecutionDocument> history = intentStore.findRecentExecutions("intent-1", 10);
        assertEquals(List.of(orphan, failed, done), history.stream().map(IntentExecutionDocument::getId).toList());

        IntentExecutionDocument partial = history.get(2);
        assertEquals(IntentExecutionStatus.PARTIAL, partial.getStatus());
        assertEquals(2, partial.getContainersUpgraded());
        assertEquals(30_000L, partial.getDurationMs());

        assertEquals("portainer unreachable", history.get(1).getErrorMessage());
        assertEquals(IntentExecutionStatus.FAILED, history.get(0).getStatus());
    }
}
