package io.dockpulse.core;

public enum ScheduleType {
    /**
     * Cron-driven; evaluated by the intent poller.
     */
    SCHEDULED,
    /**
     * Fired when a scan reports available updates; never due on its own.
     */
    IMMEDIATE
}
