package io.dockpulse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-run logger handed to job handlers.
 *
 * <p>Every entry is forwarded to SLF4J (logger {@code io.dockpulse.job.<jobType>}) and kept in memory so
 * the whole transcript can be stored on the batch run when it finishes. Debug entries are only kept
 * when debug logging is enabled for that job type.
 */
public class JobLogger {

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    public record Entry(Instant timestamp, Level level, String message, Map<String, Object> metadata) {
    }

    private final String jobType;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Logger delegate;
    private final List<Entry> entries = Collections.synchronizedList(new ArrayList<>());

    private volatile String runId;

    public JobLogger(String jobType, Clock clock, ObjectMapper objectMapper) {
        this.jobType = Objects.requireNonNull(jobType, "jobType must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.delegate = LoggerFactory.getLogger("io.dockpulse.job." + jobType);
    }

    /**
     * Mapper used when the host application does not provide one. Timestamps in metadata render as ISO-8601.
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    /**
     * Attach the persisted run id once the run record exists.
     */
    public void bindRun(String runId) {
        this.runId = runId;
    }

    public String jobType() {
        return jobType;
    }

    public void debug(String message) {
        debug(message, Map.of());
    }

    public void debug(String message, Map<String, Object> metadata) {
        if (delegate.isDebugEnabled()) {
            log(Level.DEBUG, message, metadata, null);
        }
    }

    public void info(String message) {
        info(message, Map.of());
    }

    public void info(String message, Map<String, Object> metadata) {
        log(Level.INFO, message, metadata, null);
    }

    public void warn(String message) {
        warn(message, Map.of());
    }

    public void warn(String message, Map<String, Object> metadata) {
        log(Level.WARN, message, metadata, null);
    }

    public void error(String message) {
        error(message, Map.of(), null);
    }

    public void error(String message, Throwable error) {
        error(message, Map.of(), error);
    }

    public void error(String message, Map<String, Object> metadata, Throwable error) {
        log(Level.ERROR, message, metadata, error);
    }

    private void log(Level level, String message, Map<String, Object> metadata, Throwable error) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        if (error != null) {
            meta.putIfAbsent("error", error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        }
        Entry entry = new Entry(clock.instant(), level, message, Collections.unmodifiableMap(meta));
        entries.add(entry);

        String metaText = formatMetadata(entry.metadata());
        String run = runId == null ? "-" : runId;
        switch (level) {
            case DEBUG -> delegate.debug("[{}] run={} {} {}", jobType, run, message, metaText);
            case INFO -> delegate.info("[{}] run={} {} {}", jobType, run, message, metaText);
            case WARN -> delegate.warn("[{}] run={} {} {}", jobType, run, message, metaText);
            case ERROR -> {
                if (error != null) {
                    delegate.error("[{}] run={} {} {}", jobType, run, message, metaText, error);
                } else {
                    delegate.error("[{}] run={} {} {}", jobType, run, message, metaText);
                }
            }
        }
    }

    public List<Entry> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    /**
     * Transcript in the form {@code [timestamp] [LEVEL] [jobType] [run:id] message key=value ...}, one entry
     * per line.
     */
    public String formattedLogs() {
        String run = runId == null ? "" : " [run:" + runId + "]";
        StringBuilder sb = new StringBuilder();
        for (Entry e : entries()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append('[').append(e.timestamp()).append("] [")
                    .append(e.level()).append("] [")
                    .append(jobType).append(']')
                    .append(run).append(' ')
                    .append(e.message());
            String meta = formatMetadata(e.metadata());
            if (!meta.isEmpty()) {
                sb.append(' ').append(meta);
            }
        }
        return sb.toString();
    }

    private String formatMetadata(Map<String, Object> metadata) {
        if (metadata.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (var e : metadata.entrySet()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(e.getKey()).append('=').append(toJson(e.getValue()));
        }
        return sb.toString();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }
}
