package io.github.drompincen.aigov.runtime.developer;

import io.github.drompincen.aigov.persistence.document.DeveloperSessionDocument;
import io.github.drompincen.aigov.persistence.repository.DeveloperSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Delegated development: runs the coding CLI and keeps a resumable record of each session.
 * Status is {@code completed} or {@code failed} after a first run and {@code active} after a
 * successful resume.
 */
@Service
public class DeveloperSessionService {

    private static final Logger log = LoggerFactory.getLogger(DeveloperSessionService.class);

    public static final String ACTIVE = "active";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
    public static final int DEFAULT_MAX_TURNS = 20;

    private final DeveloperSessionRepository repository;
    private final DeveloperCliRunner cliRunner;
    private final Clock clock;
    private final Path defaultWorkingDirectory;

    public DeveloperSessionService(DeveloperSessionRepository repository,
                                   DeveloperCliRunner cliRunner,
                                   Clock clock,
                                   @Value("${aigov.developer.working-directory:.}") String defaultWorkingDirectory) {
        this.repository = repository;
        this.cliRunner = cliRunner;
        this.clock = clock;
        this.defaultWorkingDirectory = Path.of(defaultWorkingDirectory);
    }

    public DeveloperSessionDocument invoke(String projectId, String governanceSessionId, String prompt,
                                           Path workingDirectory, List<String> allowedTools, Integer maxTurns) {
        Path dir = workingDirectory != null ? workingDirectory : defaultWorkingDirectory;
        Instant now = clock.instant();
        DeveloperSessionDocument doc = new DeveloperSessionDocument();
        doc.setProjectId(projectId);
        doc.setGovernanceSessionId(governanceSessionId);
        doc.setPrompt(prompt);
        doc.setWorkingDirectory(dir.toString());
        doc.setCreatedAt(now);

        try {
            CliResult result = cliRunner.run(prompt, null, maxTurns != null ? maxTurns : DEFAULT_MAX_TURNS,
                    allowedTools, dir);
            doc.setSessionId(result.cliSessionId() != null ? result.cliSessionId() : UUID.randomUUID().toString());
            doc.setStatus(result.success() ? COMPLETED : FAILED);
            doc.setResult(result.output());
            doc.setNumTurns(result.numTurns());
        } catch (DeveloperCliException e) {
            log.warn("Developer CLI failed for project {}: {}", projectId, e.getMessage());
            doc.setSessionId(UUID.randomUUID().toString());
            doc.setStatus(FAILED);
            doc.setResult(e.getMessage());
        }
        doc.setInvocations(1);
        doc.setUpdatedAt(clock.instant());
        repository.save(doc);
        log.info("Developer session {} for project {}: {}", doc.getSessionId(), projectId, doc.getStatus());
        return doc;
    }

    /**
     * Continues an earlier session with a new prompt. Empty when no such session exists.
     */
    public Optional<DeveloperSessionDocument> resume(String sessionId, String prompt, Integer maxTurns) {
        Optional<DeveloperSessionDocument> found = repository.findById(sessionId);
        if (found.isEmpty()) return Optional.empty();
        DeveloperSessionDocument doc = found.get();

        try {
            CliResult result = cliRunner.run(prompt, sessionId, maxTurns, null, Path.of(doc.getWorkingDirectory()));
            doc.setStatus(result.success() ? ACTIVE : FAILED);
            doc.setResult(result.output());
            doc.setNumTurns(doc.getNumTurns() + result.numTurns());
        } catch (DeveloperCliException e) {
            log.warn("Developer CLI resume failed for session {}: {}", sessionId, e.getMessage());
            doc.setStatus(FAILED);
            doc.setResult(e.getMessage());
        }
        doc.setPrompt(prompt);
        doc.setInvocations(doc.getInvocations() + 1);
        doc.setUpdatedAt(clock.instant());
        repository.save(doc);
        return Optional.of(doc);
    }

    public Optional<DeveloperSessionDocument> get(String sessionId) {
        return repository.findById(sessionId);
    }

    public List<DeveloperSessionDocument> list(String status, int limit) {
        List<DeveloperSessionDocument> recent = repository.findAllByOrderByUpdatedAtDesc(PageRequest.of(0, Math.max(limit, 1) * 5));
        return recent.stream()
                .filter(d -> status == null || "all".equals(status) || status.equals(d.getStatus()))
                .limit(Math.max(limit, 1))
                .collect(Collectors.toList());
    }

    public static boolean canResume(DeveloperSessionDocument doc) {
        return !FAILED.equals(doc.getStatus());
    }
}
