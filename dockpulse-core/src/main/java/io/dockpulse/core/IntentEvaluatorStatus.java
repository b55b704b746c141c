package io.dockpulse.core;

import java.time.Duration;
import java.util.Set;

public record IntentEvaluatorStatus(
        boolean running,
        Duration checkInterval,
        Set<String> inProgressIntents
) {
}
