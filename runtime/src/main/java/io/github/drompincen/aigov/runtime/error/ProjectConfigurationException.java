package io.github.drompincen.aigov.runtime.error;

public class ProjectConfigurationException extends GovernanceException {

    public ProjectConfigurationException(String message) {
        super(message);
    }

    public ProjectConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
