package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.tools.ToolResult;

public class ListPullRequestFilesTool extends GitHubTool {

    @Override public String name() { return "list_pr_files"; }
    @Override public String description() { return "List the files changed by a pull request"; }

    @Override protected void describeInput(ObjectNode props) {
        props.putObject("pull_number").put("type", "integer");
    }

    @Override protected String[] requiredInput() { return new String[]{"pull_number"}; }

    @Override
    protected ToolResult call(String repository, JsonNode input) {
        JsonNode files = gitHubClient.listPullRequestFiles(repository, input.get("pull_number").asInt());
        ArrayNode arr = MAPPER.createArrayNode();
        for (JsonNode f : files) {
            ObjectNode n = arr.addObject();
            n.put("filename", f.path("filename").asText());
            n.put("status", f.path("status").asText());
            n.put("additions", f.path("additions").asInt());
            n.put("deletions", f.path("deletions").asInt());
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.set("files", arr);
        result.put("count", arr.size());
        return ToolResult.success(result);
    }
}
