package io.dockpulse.core;

public class UnknownJobTypeException extends ConfigurationException {

    private final String jobType;

    public UnknownJobTypeException(String jobType) {
        super("No handler registered for job type: " + jobType);
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }
}
