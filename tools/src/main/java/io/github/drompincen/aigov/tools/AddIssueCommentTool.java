package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.tools.ToolResult;

public class AddIssueCommentTool extends GitHubTool {

    @Override public String name() { return "add_issue_comment"; }
    @Override public String description() { return "Comment on a GitHub issue or pull request"; }

    @Override protected void describeInput(ObjectNode props) {
        props.putObject("issue_number").put("type", "integer");
        props.putObject("body").put("type", "string").put("description", "Markdown comment");
    }

    @Override protected String[] requiredInput() { return new String[]{"issue_number", "body"}; }

    @Override
    protected ToolResult call(String repository, JsonNode input) {
        int number = input.get("issue_number").asInt();
        JsonNode comment = gitHubClient.addIssueComment(repository, number, input.get("body").asText());
        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        result.put("comment_id", comment.path("id").asLong());
        result.put("url", comment.path("html_url").asText(null));
        return ToolResult.success(result);
    }
}
