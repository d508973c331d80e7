package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.tools.ToolResult;

public class GetPullRequestTool extends GitHubTool {

    @Override public String name() { return "get_pull_request"; }
    @Override public String description() { return "Read a GitHub pull request"; }

    @Override protected void describeInput(ObjectNode props) {
        props.putObject("pull_number").put("type", "integer");
    }

    @Override protected String[] requiredInput() { return new String[]{"pull_number"}; }

    @Override
    protected ToolResult call(String repository, JsonNode input) {
        JsonNode pr = gitHubClient.getPullRequest(repository, input.get("pull_number").asInt());
        ObjectNode result = issueSummary(pr);
        result.put("body", pr.path("body").asText(null));
        result.put("draft", pr.path("draft").asBoolean(false));
        result.put("merged", pr.path("merged").asBoolean(false));
        result.put("mergeable", pr.path("mergeable").asText(null));
        result.put("head", pr.path("head").path("ref").asText(null));
        result.put("base", pr.path("base").path("ref").asText(null));
        result.put("additions", pr.path("additions").asInt());
        result.put("deletions", pr.path("deletions").asInt());
        result.put("changed_files", pr.path("changed_files").asInt());
        return ToolResult.success(result);
    }
}
