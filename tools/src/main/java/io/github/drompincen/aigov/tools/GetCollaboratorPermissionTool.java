package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.tools.ToolResult;

public class GetCollaboratorPermissionTool extends GitHubTool {

    @Override public String name() { return "get_collaborator_permission"; }
    @Override public String description() { return "Look up a user's permission level on the repository"; }

    @Override protected void describeInput(ObjectNode props) {
        props.putObject("username").put("type", "string");
    }

    @Override protected String[] requiredInput() { return new String[]{"username"}; }

    @Override
    protected ToolResult call(String repository, JsonNode input) {
        String[] parts = repository.split("/", 2);
        String username = input.get("username").asText();
        String permission = gitHubClient.permissionFor(parts[0], parts[1], username);
        ObjectNode result = MAPPER.createObjectNode();
        result.put("username", username);
        result.put("permission", permission != null ? permission : "none");
        return ToolResult.success(result);
    }
}
