package io.dockpulse.core;

import io.dockpulse.JobHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Job type to handler mapping. Registration order is preserved.
 */
public class JobHandlerRegistry {

    private volatile Map<String, JobHandler> handlersByType = Map.of();

    public JobHandlerRegistry() {
    }

    public JobHandlerRegistry(List<? extends JobHandler> handlers) {
        handlers.forEach(this::register);
    }

    public synchronized void register(JobHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        String jobType = handler.jobType();
        if (jobType == null || jobType.isBlank()) {
            throw new ConfigurationException("JobHandler jobType must not be blank: " + handler.getClass().getName());
        }
        if (handlersByType.containsKey(jobType)) {
            throw new DuplicateHandlerException(jobType);
        }
        Map<String, JobHandler> next = new LinkedHashMap<>(handlersByType);
        next.put(jobType, handler);
        handlersByType = next;
    }

    public Optional<JobHandler> find(String jobType) {
        return Optional.ofNullable(handlersByType.get(jobType));
    }

    public JobHandler getRequired(String jobType) {
        JobHandler handler = handlersByType.get(jobType);
        if (handler == null) {
            throw new UnknownJobTypeException(jobType);
        }
        return handler;
    }

    public List<String> jobTypes() {
        return List.copyOf(handlersByType.keySet());
    }

    public boolean isEmpty() {
        return handlersByType.isEmpty();
    }

    public int size() {
        return handlersByType.size();
    }
}
