package io.dockpulse.core;

import io.dockpulse.JobResult;

/**
 * Receives successful scan completions that found updates.
 */
public interface ScanCompletionListener {
    void onScanCompleted(String userId, String jobType, JobResult result);
}
