package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.ChallengeDocument;
import io.github.drompincen.aigov.persistence.repository.ChallengeRepository;
import io.github.drompincen.aigov.protocol.api.ChallengeStatus;
import io.github.drompincen.aigov.runtime.tools.*;

import java.util.List;

public class ListChallengesTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private ChallengeRepository challengeRepository;

    @Override public String name() { return "list_challenges"; }
    @Override public String description() { return "List challenges to decisions in a project, optionally by status"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("project_id").put("type", "string");
        ObjectNode status = props.putObject("status");
        status.put("type", "string").put("description", "Filter by status (optional)");
        status.putArray("enum").add("pending").add("accepted").add("rejected").add("withdrawn");
        return schema;
    }

    public void setChallengeRepository(ChallengeRepository challengeRepository) {
        this.challengeRepository = challengeRepository;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (challengeRepository == null) return ToolResult.failure("Challenge repository not available");
        String projectId = ToolInputs.projectId(ctx, input);
        if (projectId == null) return ToolResult.failure("'project_id' is required");

        String statusStr = ToolInputs.text(input, "status");
        List<ChallengeDocument> challenges;
        if (statusStr == null) {
            challenges = challengeRepository.findByProjectIdOrderBySubmittedAtDesc(projectId);
        } else {
            ChallengeStatus status;
            try {
                status = ChallengeStatus.valueOf(statusStr.toUpperCase());
            } catch (IllegalArgumentException e) {
                return ToolResult.failure("Invalid status: " + statusStr + ". Use pending, accepted, rejected or withdrawn.");
            }
            challenges = challengeRepository.findByProjectIdAndStatusOrderBySubmittedAtDesc(projectId, status);
        }

        ArrayNode arr = MAPPER.createArrayNode();
        challenges.forEach(c -> arr.add(SubmitChallengeTool.toJson(c)));
        ObjectNode result = MAPPER.createObjectNode();
        result.set("challenges", arr);
        result.put("count", challenges.size());
        return ToolResult.success(result);
    }
}
