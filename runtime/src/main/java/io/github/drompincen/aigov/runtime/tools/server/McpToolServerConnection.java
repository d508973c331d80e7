package io.github.drompincen.aigov.runtime.tools.server;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.protocol.api.ToolSpec;
import io.github.drompincen.aigov.runtime.tools.ToolResult;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tool server reached through the Model Context Protocol.
 */
public class McpToolServerConnection implements ToolServerConnection {

    private static final Logger log = LoggerFactory.getLogger(McpToolServerConnection.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String serverName;
    private final McpSyncClient client;
    private final List<ToolSpec> tools;

    public McpToolServerConnection(String serverName, McpSyncClient client) {
        this.serverName = serverName;
        this.client = client;
        this.tools = client.listTools().tools().stream()
                .map(t -> new ToolSpec(t.name(), t.description(), schemaOf(t)))
                .collect(Collectors.toList());
    }

    @Override
    public String serverName() { return serverName; }

    @Override
    public List<ToolSpec> tools() { return tools; }

    @Override
    public ToolResult call(String toolName, JsonNode arguments) {
        Map<String, Object> args = arguments == null || arguments.isNull()
                ? Map.of()
                : MAPPER.convertValue(arguments, new TypeReference<Map<String, Object>>() {});
        McpSchema.CallToolResult result = client.callTool(new McpSchema.CallToolRequest(toolName, args));
        String text = result.content().stream()
                .filter(c -> c instanceof McpSchema.TextContent)
                .map(c -> ((McpSchema.TextContent) c).text())
                .collect(Collectors.joining("\n"));
        if (Boolean.TRUE.equals(result.isError())) {
            return ToolResult.failure(text.isEmpty() ? "Tool " + toolName + " failed" : text);
        }
        return ToolResult.success(parseOrText(text));
    }

    @Override
    public void close() {
        if (!client.closeGracefully()) {
            log.warn("Tool server {} did not close gracefully", serverName);
        }
    }

    private static JsonNode schemaOf(McpSchema.Tool tool) {
        if (tool.inputSchema() == null) {
            ObjectNode empty = MAPPER.createObjectNode();
            empty.put("type", "object");
            empty.putObject("properties");
            return empty;
        }
        return MAPPER.valueToTree(tool.inputSchema());
    }

    private static JsonNode parseOrText(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            try {
                return MAPPER.readTree(trimmed);
            } catch (Exception e) {
                log.trace("Tool output is not JSON, keeping text: {}", e.getMessage());
            }
        }
        return MAPPER.getNodeFactory().textNode(text);
    }
}
