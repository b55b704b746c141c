package io.dockpulse.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BatchPropertiesTest {

    @Test
    void defaultsAreValid() {
        BatchProperties props = new BatchProperties().validate();

        assertEquals(Duration.ofSeconds(30), props.getCheckInterval());
        assertEquals(Duration.ofSeconds(60), props.getIntentCheckInterval());
        assertEquals(Duration.ofMinutes(1), props.getFailureCooldown());
        assertEquals(ZoneId.of("UTC"), props.zoneId());
    }

    @Test
    void rejectsNonPositiveDurationsAndBadZone() {
        BatchProperties zeroInterval = new BatchProperties();
        zeroInterval.setCheckInterval(Duration.ZERO);
        assertThrows(IllegalArgumentException.class, zeroInterval::validate);

        BatchProperties noWorkers = new BatchProperties();
        noWorkers.setMaxConcurrency(0);
        assertThrows(IllegalArgumentException.class, noWorkers::validate);

        BatchProperties badZone = new BatchProperties();
        badZone.setTimeZone("Mars/Olympus");
        assertThrows(IllegalArgumentException.class, badZone::validate);
    }
}
