package io.dockpulse.spi;

import io.dockpulse.core.BatchConfig;

import java.util.Map;

/**
 * Read-only view of per-user batch settings.
 */
public interface BatchConfigSource {

    /**
     * Stored configs for a user keyed by job type. Job types without a stored config are absent.
     */
    Map<String, BatchConfig> findConfigs(String userId);
}
