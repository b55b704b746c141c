package io.dockpulse.core;

import java.util.List;

public record BatchStatus(
        boolean started,
        List<String> registeredJobs,
        List<JobKey> runningJobs,
        SchedulerStatus scheduler,
        IntentEvaluatorStatus intentEvaluator
) {
}
