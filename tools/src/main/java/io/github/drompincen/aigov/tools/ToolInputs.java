package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.aigov.runtime.tools.ToolContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Input helpers shared by the governance tools.
 */
final class ToolInputs {

    private ToolInputs() {}

    /**
     * The session's project when the tool runs inside an agent session; the {@code project_id} argument
     * otherwise. A session can never reach into another project's records.
     */
    static String projectId(ToolContext ctx, JsonNode input) {
        if (ctx != null && ctx.projectId() != null && !ctx.projectId().isBlank()) return ctx.projectId();
        return text(input, "project_id");
    }

    static String text(JsonNode input, String field) {
        String value = input.path(field).asText(null);
        return value == null || value.isBlank() ? null : value;
    }

    static List<String> strings(JsonNode input, String field) {
        List<String> values = new ArrayList<>();
        JsonNode node = input.path(field);
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual() && !item.asText().isBlank()) values.add(item.asText());
            }
        } else if (node.isTextual() && !node.asText().isBlank()) {
            for (String part : node.asText().split(",")) {
                if (!part.isBlank()) values.add(part.trim());
            }
        }
        return values;
    }

    /** The acting identity: an explicit argument, else the session's role. */
    static String actor(ToolContext ctx, JsonNode input, String field) {
        String explicit = text(input, field);
        if (explicit != null) return explicit;
        return ctx != null ? ctx.roleName() : null;
    }
}
