package io.github.drompincen.aigov.runtime.developer;

import io.github.drompincen.aigov.runtime.error.GovernanceException;

public class DeveloperCliException extends GovernanceException {

    public DeveloperCliException(String message) {
        super(message);
    }

    public DeveloperCliException(String message, Throwable cause) {
        super(message, cause);
    }
}
