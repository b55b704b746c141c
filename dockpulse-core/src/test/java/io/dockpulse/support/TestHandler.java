package io.dockpulse.support;

import io.dockpulse.JobContext;
import io.dockpulse.JobHandler;
import io.dockpulse.JobResult;
import io.dockpulse.core.BatchConfig;

import java.util.concurrent.atomic.AtomicInteger;

public class TestHandler implements JobHandler {

    @FunctionalInterface
    public interface Behavior {
        JobResult run(JobContext ctx) throws Exception;
    }

    private final String jobType;
    private final BatchConfig defaultConfig;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile Behavior behavior = ctx -> JobResult.of(1, 0);

    public TestHandler(String jobType) {
        this(jobType, BatchConfig.defaults());
    }

    public TestHandler(String jobType, BatchConfig defaultConfig) {
        this.jobType = jobType;
        this.defaultConfig = defaultConfig;
    }

    public TestHandler behave(Behavior behavior) {
        this.behavior = behavior;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public String jobType() {
        return jobType;
    }

    @Override
    public String displayName() {
        return "Test " + jobType;
    }

    @Override
    public BatchConfig defaultConfig() {
        return defaultConfig;
    }

    @Override
    public JobResult execute(JobContext ctx) throws Exception {
        calls.incrementAndGet();
        return behavior.run(ctx);
    }
}
