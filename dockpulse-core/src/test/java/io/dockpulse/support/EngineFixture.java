package io.dockpulse.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dockpulse.config.BatchProperties;
import io.dockpulse.core.IntentExecutionResult;
import io.dockpulse.core.ScheduleEvaluator;
import io.dockpulse.internal.BatchManager;
import io.dockpulse.internal.IntentEvaluator;
import io.dockpulse.internal.ScanCompletionBus;
import io.dockpulse.spi.IntentExecutor;

import java.util.concurrent.Executor;

/**
 * Engine wired against in-memory stores. Handlers and intents run on the calling thread unless an
 * executor is given.
 */
public class EngineFixture {

    public final MutableClock clock;
    public final BatchProperties props = new BatchProperties();
    public final InMemoryBatchRunStore runStore = new InMemoryBatchRunStore();
    public final InMemoryIntentStore intentStore = new InMemoryIntentStore();
    public final StaticDirectory directory = new StaticDirectory();
    public final ScanCompletionBus bus = new ScanCompletionBus();
    public final IntentEvaluator intentEvaluator;
    public final BatchManager batchManager;

    public EngineFixture(MutableClock clock, IntentExecutor intentExecutor) {
        this(clock, intentExecutor, Runnable::run);
    }

    public EngineFixture(MutableClock clock, IntentExecutor intentExecutor, Executor jobExecutor) {
        this.clock = clock;
        this.intentEvaluator = new IntentEvaluator(intentStore, directory, new ScheduleEvaluator(), intentExecutor,
                bus, props, clock, Runnable::run);
        this.batchManager = new BatchManager(props, runStore, directory, directory, intentStore, intentEvaluator,
                bus, new ObjectMapper(), clock, jobExecutor);
    }

    public static EngineFixture at(String isoInstant) {
        return new EngineFixture(MutableClock.at(isoInstant), (intent, userId, trigger) -> IntentExecutionResult.nothingMatched());
    }
}
