package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.error.GitHubApiException;
import io.github.drompincen.aigov.runtime.github.GitHubClient;
import io.github.drompincen.aigov.runtime.tools.Tool;
import io.github.drompincen.aigov.runtime.tools.ToolContext;
import io.github.drompincen.aigov.runtime.tools.ToolResult;

/**
 * Base for tools that act on the project's GitHub repository. Inside a session the project's
 * repository always wins; the {@code repository} argument is only read outside one.
 */
public abstract class GitHubTool implements Tool {

    protected static final ObjectMapper MAPPER = new ObjectMapper();
    protected GitHubClient gitHubClient;

    public void setGitHubClient(GitHubClient gitHubClient) {
        this.gitHubClient = gitHubClient;
    }

    /** Tool-specific properties; {@code repository} is added to every schema. */
    protected abstract void describeInput(ObjectNode properties);

    protected abstract String[] requiredInput();

    protected abstract ToolResult call(String repository, JsonNode input);

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("repository").put("type", "string").put("description", "owner/name, used outside a project session");
        describeInput(props);
        ArrayNode required = schema.putArray("required");
        for (String field : requiredInput()) required.add(field);
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (gitHubClient == null || !gitHubClient.isAvailable()) return ToolResult.failure("GitHub not available");
        String repository = ctx != null && ctx.repository() != null && !ctx.repository().isBlank()
                ? ctx.repository() : ToolInputs.text(input, "repository");
        if (repository == null || !repository.contains("/")) return ToolResult.failure("'repository' is required as owner/name");
        for (String field : requiredInput()) {
            if (input.path(field).isMissingNode() || input.path(field).isNull()
                    || (input.path(field).isTextual() && input.path(field).asText().isBlank())) {
                return ToolResult.failure("'" + field + "' is required");
            }
        }
        try {
            return call(repository, input);
        } catch (GitHubApiException e) {
            return ToolResult.failure("GitHub request failed: " + e.getMessage());
        }
    }

    protected static ObjectNode issueSummary(JsonNode issue) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("number", issue.path("number").asInt());
        n.put("title", issue.path("title").asText(null));
        n.put("state", issue.path("state").asText(null));
        n.put("author", issue.path("user").path("login").asText(null));
        n.put("url", issue.path("html_url").asText(null));
        ArrayNode labels = n.putArray("labels");
        issue.path("labels").forEach(l -> labels.add(l.path("name").asText()));
        return n;
    }
}
