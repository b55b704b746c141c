package io.dockpulse.core;

/**
 * Summary returned by the intent execution collaborator.
 */
public record IntentExecutionResult(
        IntentExecutionStatus status,
        int containersMatched,
        int containersUpgraded,
        int containersFailed,
        int containersSkipped
) {

    public static IntentExecutionResult nothingMatched() {
        return new IntentExecutionResult(IntentExecutionStatus.COMPLETED, 0, 0, 0, 0);
    }
}
