package io.dockpulse.internal;

import io.dockpulse.JobResult;
import io.dockpulse.core.ScanCompletionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process fan-out of scan completions from {@link BatchManager} to interested components.
 *
 * <p>Listeners are called on the publishing thread. A failing listener is logged and never reaches the
 * publisher or the other listeners.
 */
public class ScanCompletionBus {
    private static final Logger log = LoggerFactory.getLogger(ScanCompletionBus.class);

    private final CopyOnWriteArrayList<ScanCompletionListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(ScanCompletionListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.addIfAbsent(listener);
    }

    public void unsubscribe(ScanCompletionListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void publish(String userId, String jobType, JobResult result) {
        for (ScanCompletionListener listener : listeners) {
            try {
                listener.onScanCompleted(userId, jobType, result);
            } catch (Exception e) {
                log.error("scan completion listener failed userId={} jobType={} listener={} msg={}",
                        userId, jobType, listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
