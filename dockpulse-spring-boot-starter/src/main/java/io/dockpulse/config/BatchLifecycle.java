package io.dockpulse.config;

import io.dockpulse.BatchSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the batch engine's start/stop lifecycle with the Spring container lifecycle.
 *
 * <p>Runs in the last phase so stores and handler beans are fully up before the first poll, and the engine
 * is stopped before them.
 */
public class BatchLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(BatchLifecycle.class);

    private final BatchSystem batchSystem;
    private volatile boolean running = false;

    public BatchLifecycle(BatchSystem batchSystem) {
        this.batchSystem = batchSystem;
    }

    @Override
    public void start() {
        batchSystem.start();
        // an engine without handlers declines to start
        running = batchSystem.getStatus().started();
        log.info("dockpulse lifecycle started engineRunning={} jobTypes={}", running, batchSystem.getRegisteredJobTypes());
    }

    @Override
    public void stop() {
        batchSystem.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
