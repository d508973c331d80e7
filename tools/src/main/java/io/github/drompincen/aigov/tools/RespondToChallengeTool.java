package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.ChallengeDocument;
import io.github.drompincen.aigov.persistence.repository.ChallengeRepository;
import io.github.drompincen.aigov.protocol.api.ChallengeStatus;
import io.github.drompincen.aigov.runtime.tools.*;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Closes a pending challenge as accepted or rejected. Answered challenges cannot be answered again.
 */
public class RespondToChallengeTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private ChallengeRepository challengeRepository;
    private Clock clock = Clock.systemUTC();

    @Override public String name() { return "respond_to_challenge"; }
    @Override public String description() { return "Respond to a pending challenge, accepting or rejecting it"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("challenge_id").put("type", "string");
        props.putObject("responded_by").put("type", "string");
        props.putObject("response").put("type", "string").put("description", "Reasoned response to the argument");
        ObjectNode outcome = props.putObject("outcome");
        outcome.put("type", "string");
        outcome.putArray("enum").add("accepted").add("rejected");
        schema.putArray("required").add("challenge_id").add("response").add("outcome");
        return schema;
    }

    public void setChallengeRepository(ChallengeRepository challengeRepository) {
        this.challengeRepository = challengeRepository;
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (challengeRepository == null) return ToolResult.failure("Challenge repository not available");
        String challengeId = ToolInputs.text(input, "challenge_id");
        String respondedBy = ToolInputs.actor(ctx, input, "responded_by");
        String response = ToolInputs.text(input, "response");
        String outcome = ToolInputs.text(input, "outcome");
        if (challengeId == null) return ToolResult.failure("'challenge_id' is required");
        if (respondedBy == null) return ToolResult.failure("'responded_by' is required");
        if (response == null) return ToolResult.failure("'response' is required");
        if (outcome == null) return ToolResult.failure("'outcome' is required");

        ChallengeStatus status = switch (outcome.toLowerCase()) {
            case "accepted" -> ChallengeStatus.ACCEPTED;
            case "rejected" -> ChallengeStatus.REJECTED;
            default -> null;
        };
        if (status == null) return ToolResult.failure("Invalid outcome: " + outcome + ". Use accepted or rejected.");

        Optional<ChallengeDocument> found = challengeRepository.findById(challengeId);
        if (found.isEmpty()) return ToolResult.failure("Challenge not found: " + challengeId);
        ChallengeDocument doc = found.get();
        if (doc.getStatus() != ChallengeStatus.PENDING) {
            return ToolResult.failure("Challenge " + challengeId + " is already " + doc.getStatus().name().toLowerCase());
        }

        Instant now = clock.instant();
        doc.setRespondedBy(respondedBy);
        doc.setRespondedAt(now);
        doc.setResponse(response);
        doc.setOutcome(outcome.toLowerCase());
        doc.setStatus(status);
        doc.setUpdatedAt(now);
        challengeRepository.save(doc);

        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        result.put("message", "Challenge " + outcome.toLowerCase());
        result.set("challenge", SubmitChallengeTool.toJson(doc));
        return ToolResult.success(result);
    }
}
