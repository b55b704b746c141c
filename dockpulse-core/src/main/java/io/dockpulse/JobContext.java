package io.dockpulse;

import java.util.Objects;

/**
 * Passed to {@link JobHandler#execute(JobContext)}.
 *
 * @param logger run transcript logger; entries end up on the persisted batch run
 * @param userId owner of the run
 */
public record JobContext(JobLogger logger, String userId) {
    public JobContext {
        Objects.requireNonNull(logger, "logger must not be null");
        Objects.requireNonNull(userId, "userId must not be null");
    }
}
