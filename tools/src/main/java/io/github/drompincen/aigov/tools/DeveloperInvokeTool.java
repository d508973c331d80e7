package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.DeveloperSessionDocument;
import io.github.drompincen.aigov.runtime.developer.DeveloperSessionService;
import io.github.drompincen.aigov.runtime.tools.*;

import java.nio.file.Path;
import java.util.List;

/**
 * Hands an implementation task to the coding CLI. The run is recorded as a developer session
 * that {@code developer_resume} can continue.
 */
public class DeveloperInvokeTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private DeveloperSessionService developerSessionService;

    @Override public String name() { return "developer_invoke"; }
    @Override public String description() {
        return "Delegate a development task to the coding CLI. Returns a session id that can be resumed with follow-up instructions.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("prompt").put("type", "string").put("description", "The task to carry out");
        props.putObject("working_directory").put("type", "string").put("description", "Checkout to work in (optional)");
        props.putObject("allowed_tools").put("type", "array").putObject("items").put("type", "string");
        props.putObject("max_turns").put("type", "integer").put("description", "Turn limit (default 20)");
        props.putObject("project_id").put("type", "string");
        schema.putArray("required").add("prompt");
        return schema;
    }

    public void setDeveloperSessionService(DeveloperSessionService developerSessionService) {
        this.developerSessionService = developerSessionService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (developerSessionService == null) return ToolResult.failure("Developer sessions not available");
        String prompt = ToolInputs.text(input, "prompt");
        if (prompt == null) return ToolResult.failure("'prompt' is required");

        String dir = ToolInputs.text(input, "working_directory");
        Path workingDirectory = dir != null ? Path.of(dir) : (ctx != null ? ctx.workingDirectory() : null);
        List<String> allowedTools = ToolInputs.strings(input, "allowed_tools");
        Integer maxTurns = input.hasNonNull("max_turns") ? input.get("max_turns").asInt() : null;

        DeveloperSessionDocument doc = developerSessionService.invoke(
                ToolInputs.projectId(ctx, input),
                ctx != null ? ctx.sessionId() : null,
                prompt, workingDirectory,
                allowedTools.isEmpty() ? null : allowedTools,
                maxTurns);
        return ToolResult.success(toJson(doc, true));
    }

    static ObjectNode toJson(DeveloperSessionDocument doc, boolean withResult) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("session_id", doc.getSessionId());
        n.put("project_id", doc.getProjectId());
        n.put("status", doc.getStatus());
        n.put("num_turns", doc.getNumTurns());
        n.put("invocations", doc.getInvocations());
        n.put("working_directory", doc.getWorkingDirectory());
        n.put("can_resume", DeveloperSessionService.canResume(doc));
        n.put("created_at", doc.getCreatedAt() != null ? doc.getCreatedAt().toString() : null);
        n.put("updated_at", doc.getUpdatedAt() != null ? doc.getUpdatedAt().toString() : null);
        if (withResult) {
            n.put("prompt", doc.getPrompt());
            n.put("result", doc.getResult());
        }
        return n;
    }
}
