package io.dockpulse.spi;

import io.dockpulse.core.Intent;
import io.dockpulse.core.IntentExecutionResult;
import io.dockpulse.core.IntentTrigger;

/**
 * Match-and-upgrade logic for a single intent. Implemented outside the engine.
 *
 * <p>Runs on an engine worker thread; timeouts for remote calls are the implementation's concern.
 */
@FunctionalInterface
public interface IntentExecutor {
    IntentExecutionResult execute(Intent intent, String userId, IntentTrigger trigger) throws Exception;
}
