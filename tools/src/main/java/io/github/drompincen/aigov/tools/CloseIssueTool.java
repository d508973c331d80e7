package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.tools.ToolResult;

public class CloseIssueTool extends GitHubTool {

    @Override public String name() { return "close_issue"; }
    @Override public String description() { return "Close a GitHub issue as completed or not planned"; }

    @Override protected void describeInput(ObjectNode props) {
        props.putObject("issue_number").put("type", "integer");
        ObjectNode reason = props.putObject("reason");
        reason.put("type", "string");
        reason.putArray("enum").add("completed").add("not_planned");
    }

    @Override protected String[] requiredInput() { return new String[]{"issue_number"}; }

    @Override
    protected ToolResult call(String repository, JsonNode input) {
        String reason = input.path("reason").asText("completed");
        if (!reason.equals("completed") && !reason.equals("not_planned")) {
            return ToolResult.failure("Invalid reason: " + reason + ". Use completed or not_planned.");
        }
        JsonNode issue = gitHubClient.closeIssue(repository, input.get("issue_number").asInt(), reason);
        ObjectNode result = issueSummary(issue);
        result.put("success", true);
        return ToolResult.success(result);
    }
}
