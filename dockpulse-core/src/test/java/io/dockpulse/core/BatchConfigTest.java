package io.dockpulse.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchConfigTest {

    @Test
    void defaultsAreDisabledHourly() {
        BatchConfig config = BatchConfig.defaults();
        assertFalse(config.isSchedulable());
        assertEquals(Duration.ofHours(1), config.interval());
    }

    @Test
    void subMinimumIntervalIsNotSchedulable() {
        assertFalse(new BatchConfig(true, 0).isSchedulable());
        assertTrue(BatchConfig.enabledEvery(1).isSchedulable());
    }

    @Test
    void validateEnforcesBounds() {
        assertThrows(ConfigurationException.class, () -> new BatchConfig(true, 0).validate());
        assertThrows(ConfigurationException.class, () -> new BatchConfig(true, 1441).validate());
        assertEquals(1440, BatchConfig.enabledEvery(1440).validate().intervalMinutes());
    }
}
