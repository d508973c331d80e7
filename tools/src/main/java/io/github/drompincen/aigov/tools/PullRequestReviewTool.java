package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.tools.ToolResult;

import java.util.Set;

public class PullRequestReviewTool extends GitHubTool {

    private static final Set<String> EVENTS = Set.of("APPROVE", "REQUEST_CHANGES", "COMMENT");

    @Override public String name() { return "pull_request_review_write"; }
    @Override public String description() { return "Submit a review on a pull request: approve, request changes or comment"; }

    @Override protected void describeInput(ObjectNode props) {
        props.putObject("pull_number").put("type", "integer");
        ObjectNode event = props.putObject("event");
        event.put("type", "string");
        event.putArray("enum").add("APPROVE").add("REQUEST_CHANGES").add("COMMENT");
        props.putObject("body").put("type", "string");
    }

    @Override protected String[] requiredInput() { return new String[]{"pull_number", "event"}; }

    @Override
    protected ToolResult call(String repository, JsonNode input) {
        String event = input.get("event").asText().toUpperCase();
        if (!EVENTS.contains(event)) return ToolResult.failure("Invalid event: " + event);
        String body = input.path("body").asText("");
        if (!event.equals("APPROVE") && body.isBlank()) {
            return ToolResult.failure("'body' is required for " + event.toLowerCase());
        }
        JsonNode review = gitHubClient.createReview(repository, input.get("pull_number").asInt(), event, body);
        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        result.put("review_id", review.path("id").asLong());
        result.put("state", review.path("state").asText(null));
        return ToolResult.success(result);
    }
}
