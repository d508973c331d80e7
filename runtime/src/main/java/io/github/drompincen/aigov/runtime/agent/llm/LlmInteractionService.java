package io.github.drompincen.aigov.runtime.agent.llm;

import io.github.drompincen.aigov.persistence.document.LlmInteractionDocument;
import io.github.drompincen.aigov.persistence.repository.LlmInteractionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Persists one record per LLM call for the self-observability tools.
 */
@Service
public class LlmInteractionService {

    private static final Logger log = LoggerFactory.getLogger(LlmInteractionService.class);

    private final LlmInteractionRepository llmInteractionRepository;
    private final Clock clock;

    public LlmInteractionService(LlmInteractionRepository llmInteractionRepository, Clock clock) {
        this.llmInteractionRepository = llmInteractionRepository;
        this.clock = clock;
    }

    public void recordSuccess(String sessionId, String projectId, String roleName, String provider,
                              LlmRequest request, LlmResponse response, long durationMs) {
        LlmInteractionDocument doc = base(sessionId, projectId, roleName, provider, request, durationMs);
        doc.setModel(response.model() != null ? response.model() : request.model());
        doc.setPromptTokens(response.usage().inputTokens());
        doc.setCompletionTokens(response.usage().outputTokens());
        doc.setStopReason(response.stopReason() != null ? response.stopReason().name().toLowerCase() : null);
        doc.setSuccess(true);
        save(doc);
    }

    public void recordFailure(String sessionId, String projectId, String roleName, String provider,
                              LlmRequest request, Exception error, long durationMs) {
        LlmInteractionDocument doc = base(sessionId, projectId, roleName, provider, request, durationMs);
        doc.setModel(request.model());
        doc.setSuccess(false);
        doc.setErrorMessage(error.getMessage());
        save(doc);
    }

    public List<LlmInteractionDocument> forSession(String sessionId) {
        return llmInteractionRepository.findBySessionIdOrderByTimestampAsc(sessionId);
    }

    public LlmMetrics metrics(Duration window) {
        List<LlmInteractionDocument> calls =
                llmInteractionRepository.findByTimestampAfterOrderByTimestampDesc(clock.instant().minus(window));
        long failures = calls.stream().filter(c -> !c.isSuccess()).count();
        long promptTokens = calls.stream().mapToLong(LlmInteractionDocument::getPromptTokens).sum();
        long completionTokens = calls.stream().mapToLong(LlmInteractionDocument::getCompletionTokens).sum();
        double avgDuration = calls.stream().mapToLong(LlmInteractionDocument::getDurationMs).average().orElse(0);
        return new LlmMetrics(calls.size(), failures, promptTokens, completionTokens, avgDuration);
    }

    private LlmInteractionDocument base(String sessionId, String projectId, String roleName, String provider,
                                        LlmRequest request, long durationMs) {
        LlmInteractionDocument doc = new LlmInteractionDocument();
        doc.setInteractionId(UUID.randomUUID().toString());
        doc.setSessionId(sessionId);
        doc.setProjectId(projectId);
        doc.setRoleName(roleName);
        doc.setProvider(provider);
        doc.setMessageCount(request.messages().size());
        doc.setDurationMs(durationMs);
        doc.setTimestamp(clock.instant());
        return doc;
    }

    private void save(LlmInteractionDocument doc) {
        try {
            llmInteractionRepository.save(doc);
        } catch (Exception e) {
            log.warn("Failed to record LLM interaction for session {}: {}", doc.getSessionId(), e.getMessage());
        }
    }

    public record LlmMetrics(long calls, long failures, long promptTokens, long completionTokens,
                             double averageDurationMs) {}
}
