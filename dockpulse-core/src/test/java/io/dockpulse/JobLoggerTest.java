package io.dockpulse;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dockpulse.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JobLoggerTest {

    @Test
    void transcriptCarriesRunIdLevelAndJsonMetadata() {
        MutableClock clock = MutableClock.at("2026-01-01T10:00:00Z");
        JobLogger logger = new JobLogger("scan", clock, new ObjectMapper());
        logger.bindRun("run-7");

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("image", "nginx");
        meta.put("tags", List.of("1.25", "latest"));
        logger.info("checking image", meta);
        clock.set("2026-01-01T10:00:05Z");
        logger.warn("registry slow");

        assertThat(logger.formattedLogs()).isEqualTo(
                "[2026-01-01T10:00:00Z] [INFO] [scan] [run:run-7] checking image image=\"nginx\" tags=[\"1.25\",\"latest\"]\n"
                        + "[2026-01-01T10:00:05Z] [WARN] [scan] [run:run-7] registry slow");
    }

    @Test
    void errorEntryRecordsExceptionMessage() {
        JobLogger logger = new JobLogger("scan", MutableClock.at("2026-01-01T10:00:00Z"), new ObjectMapper());

        logger.error("lookup failed", new IllegalStateException("timeout"));

        JobLogger.Entry entry = logger.entries().get(0);
        assertThat(entry.level()).isEqualTo(JobLogger.Level.ERROR);
        assertThat(entry.metadata()).containsEntry("error", "timeout");
        assertThat(logger.formattedLogs()).doesNotContain("[run:");
    }

    @Test
    void defaultMapperRendersInstantsAsIsoText() {
        JobLogger logger = new JobLogger("scan", MutableClock.at("2026-01-01T10:00:00Z"), JobLogger.defaultObjectMapper());

        logger.info("image pushed", Map.of("pushedAt", Instant.parse("2025-12-31T23:00:00Z")));

        assertThat(logger.formattedLogs()).endsWith("image pushed pushedAt=\"2025-12-31T23:00:00Z\"");
    }
}
