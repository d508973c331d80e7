package io.github.drompincen.aigov.runtime.error;

public class GitHubApiException extends GovernanceException {

    private final int status;

    public GitHubApiException(int status, String message) {
        super("GitHub API returned " + status + ": " + message);
        this.status = status;
    }

    public GitHubApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    public int getStatus() { return status; }
}
