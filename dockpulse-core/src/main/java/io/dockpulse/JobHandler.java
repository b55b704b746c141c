package io.dockpulse;

import io.dockpulse.core.BatchConfig;

/**
 * Pluggable unit of recurring scan work, registered under its {@link #jobType()}.
 *
 * <p>Implementations throw to signal failure. A thrown {@link io.dockpulse.core.HandlerExecutionException}
 * may carry the counts processed before the failure.
 */
public interface JobHandler {
    String jobType();

    String displayName();

    /**
     * Settings used for users that have no stored config for this job type.
     */
    default BatchConfig defaultConfig() {
        return BatchConfig.defaults();
    }

    JobResult execute(JobContext context) throws Exception;
}
