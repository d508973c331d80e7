package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.tools.ToolResult;

public class GetIssueTool extends GitHubTool {

    @Override public String name() { return "get_issue"; }
    @Override public String description() { return "Read a GitHub issue"; }

    @Override protected void describeInput(ObjectNode props) {
        props.putObject("issue_number").put("type", "integer");
    }

    @Override protected String[] requiredInput() { return new String[]{"issue_number"}; }

    @Override
    protected ToolResult call(String repository, JsonNode input) {
        JsonNode issue = gitHubClient.getIssue(repository, input.get("issue_number").asInt());
        ObjectNode result = issueSummary(issue);
        result.put("body", issue.path("body").asText(null));
        result.put("comments", issue.path("comments").asInt());
        return ToolResult.success(result);
    }
}
