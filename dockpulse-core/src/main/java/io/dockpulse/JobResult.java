package io.dockpulse;

/**
 * Outcome of a successful handler run.
 *
 * <p>A non-null {@code partialReason} marks a partial success (for example a registry rate limit hit
 * half way through). Partial results are recorded as completed runs and are not retried early.
 */
public record JobResult(
        long itemsChecked,
        long itemsUpdated,
        String partialReason
) {
    public JobResult {
        if (itemsChecked < 0 || itemsUpdated < 0) {
            throw new IllegalArgumentException("item counts must not be negative");
        }
        if (partialReason != null && partialReason.isBlank()) {
            partialReason = null;
        }
    }

    public static JobResult of(long itemsChecked, long itemsUpdated) {
        return new JobResult(itemsChecked, itemsUpdated, null);
    }

    public static JobResult partial(long itemsChecked, long itemsUpdated, String reason) {
        return new JobResult(itemsChecked, itemsUpdated, reason);
    }

    public static JobResult empty() {
        return new JobResult(0, 0, null);
    }

    public boolean isPartial() {
        return partialReason != null;
    }

    public boolean hasUpdates() {
        return itemsUpdated > 0;
    }
}
