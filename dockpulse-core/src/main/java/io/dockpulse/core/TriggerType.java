package io.dockpulse.core;

public enum TriggerType {
    SCHEDULED_WINDOW("scheduled_window"),
    SCAN_DETECTED("scan_detected"),
    MANUAL("manual");

    private final String code;

    TriggerType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
