package io.github.drompincen.aigov.runtime.developer;

/**
 * Outcome of one coding CLI run. {@code cliSessionId} is null when the CLI did not report one, in
 * which case the session cannot be resumed.
 */
public record CliResult(
        boolean success,
        String output,
        String cliSessionId,
        int numTurns
) {}
