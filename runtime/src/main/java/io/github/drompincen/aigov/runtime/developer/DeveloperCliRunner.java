package io.github.drompincen.aigov.runtime.developer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Launches the external coding CLI as a subprocess in non-interactive JSON mode.
 */
@Component
public class DeveloperCliRunner {

    private static final Logger log = LoggerFactory.getLogger(DeveloperCliRunner.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String command;
    private final Duration timeout;

    public DeveloperCliRunner(@Value("${aigov.developer.command:claude}") String command,
                              @Value("${aigov.developer.timeout:PT10M}") Duration timeout) {
        this.command = command;
        this.timeout = timeout;
    }

    /**
     * @throws DeveloperCliException when the CLI cannot be started or exceeds the timeout
     */
    public CliResult run(String prompt, String resumeSessionId, Integer maxTurns, List<String> allowedTools,
                         Path workingDirectory) {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.addAll(buildArgs(prompt, resumeSessionId, maxTurns, allowedTools));

        Process process;
        try {
            process = new ProcessBuilder(cmd)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(false)
                    .start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw new DeveloperCliException("Failed to start " + command + ": " + e.getMessage(), e);
        }
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new DeveloperCliException(command + " execution timed out after " + timeout.toMinutes() + " minutes");
            }
            String out = stdout.get(5, TimeUnit.SECONDS);
            String err = stderr.get(5, TimeUnit.SECONDS);
            int exitCode = process.exitValue();
            log.info("{} exited with code {} in {}", command, exitCode, workingDirectory);
            if (exitCode != 0) {
                String output = !err.isBlank() ? err : !out.isBlank() ? out : command + " exited with code " + exitCode;
                return new CliResult(false, output, null, 0);
            }
            return parseOutput(out);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new DeveloperCliException(command + " execution interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new DeveloperCliException("Failed to read " + command + " output: " + e.getMessage(), e);
        }
    }

    static List<String> buildArgs(String prompt, String resumeSessionId, Integer maxTurns, List<String> allowedTools) {
        List<String> args = new ArrayList<>();
        args.add("-p");
        args.add(prompt);
        if (resumeSessionId != null) {
            args.add("--resume");
            args.add(resumeSessionId);
        }
        if (maxTurns != null) {
            args.add("--max-turns");
            args.add(maxTurns.toString());
        }
        if (allowedTools != null && !allowedTools.isEmpty()) {
            args.add("--allowedTools");
            args.add(String.join(",", allowedTools));
        }
        args.add("--output-format");
        args.add("json");
        return args;
    }

    /** JSON output carries {@code result}, {@code session_id} and {@code num_turns}; anything else is raw text. */
    static CliResult parseOutput(String stdout) {
        try {
            JsonNode parsed = MAPPER.readTree(stdout);
            if (parsed != null && parsed.isObject()) {
                String result = parsed.path("result").asText(null);
                return new CliResult(!parsed.path("is_error").asBoolean(false),
                        result != null && !result.isEmpty() ? result : stdout,
                        parsed.path("session_id").asText(null),
                        parsed.path("num_turns").asInt(0));
            }
        } catch (IOException e) {
            log.debug("CLI output is not JSON: {}", e.getMessage());
        }
        return new CliResult(true, stdout.isBlank() ? "Task completed" : stdout, null, 0);
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
