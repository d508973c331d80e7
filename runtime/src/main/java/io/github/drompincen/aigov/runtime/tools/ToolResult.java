package io.github.drompincen.aigov.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolResult(
        boolean success,
        JsonNode output,
        String error
) {
    public static ToolResult success(JsonNode output) {
        return new ToolResult(true, output, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error);
    }

    /** Text handed back to the model as the tool-result block. */
    public String content() {
        if (!success) return "Error: " + error;
        if (output == null || output.isNull()) return "";
        return output.isTextual() ? output.asText() : output.toPrettyString();
    }
}
