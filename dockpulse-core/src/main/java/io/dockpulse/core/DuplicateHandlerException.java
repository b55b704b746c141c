package io.dockpulse.core;

public class DuplicateHandlerException extends ConfigurationException {

    private final String jobType;

    public DuplicateHandlerException(String jobType) {
        super("Job handler for type '" + jobType + "' is already registered");
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }
}
