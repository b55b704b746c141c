package io.dockpulse.core;

public enum IntentExecutionStatus {
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED
}
