package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.tools.ToolResult;

import java.util.Set;

public class MergePullRequestTool extends GitHubTool {

    private static final Set<String> METHODS = Set.of("merge", "squash", "rebase");

    @Override public String name() { return "merge_pull_request"; }
    @Override public String description() { return "Merge a pull request. Significant action: log the decision."; }

    @Override protected void describeInput(ObjectNode props) {
        props.putObject("pull_number").put("type", "integer");
        ObjectNode method = props.putObject("merge_method");
        method.put("type", "string");
        method.putArray("enum").add("merge").add("squash").add("rebase");
        props.putObject("commit_title").put("type", "string");
    }

    @Override protected String[] requiredInput() { return new String[]{"pull_number"}; }

    @Override
    protected ToolResult call(String repository, JsonNode input) {
        String method = input.path("merge_method").asText("squash");
        if (!METHODS.contains(method)) return ToolResult.failure("Invalid merge_method: " + method);
        JsonNode merge = gitHubClient.mergePullRequest(repository, input.get("pull_number").asInt(), method,
                ToolInputs.text(input, "commit_title"));
        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", merge.path("merged").asBoolean(false));
        result.put("sha", merge.path("sha").asText(null));
        result.put("message", merge.path("message").asText(null));
        return ToolResult.success(result);
    }
}
