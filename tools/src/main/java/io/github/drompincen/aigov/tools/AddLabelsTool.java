package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.tools.ToolResult;

import java.util.List;

public class AddLabelsTool extends GitHubTool {

    @Override public String name() { return "add_labels"; }
    @Override public String description() { return "Add labels to a GitHub issue or pull request"; }

    @Override protected void describeInput(ObjectNode props) {
        props.putObject("issue_number").put("type", "integer");
        props.putObject("labels").put("type", "array").putObject("items").put("type", "string");
    }

    @Override protected String[] requiredInput() { return new String[]{"issue_number", "labels"}; }

    @Override
    protected ToolResult call(String repository, JsonNode input) {
        List<String> labels = ToolInputs.strings(input, "labels");
        if (labels.isEmpty()) return ToolResult.failure("'labels' must not be empty");
        JsonNode applied = gitHubClient.addLabels(repository, input.get("issue_number").asInt(), labels);
        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        ArrayNode names = result.putArray("labels");
        applied.forEach(l -> names.add(l.path("name").asText()));
        return ToolResult.success(result);
    }
}
