package io.github.drompincen.aigov.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.protocol.api.ToolPermissions;
import io.github.drompincen.aigov.protocol.api.ToolSpec;
import io.github.drompincen.aigov.runtime.tools.server.ToolServerConnection;
import io.github.drompincen.aigov.runtime.tools.server.ToolServerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Routes tool calls to their owning backend: an in-process governance handler or an external tool
 * server. In-process handlers win name collisions. {@link #executeTool} never throws; every failure
 * comes back as {@link ToolResult#failure(String)}.
 */
@Service
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry toolRegistry;
    private final ToolServerManager toolServerManager;

    public ToolDispatcher(ToolRegistry toolRegistry, ToolServerManager toolServerManager) {
        this.toolRegistry = toolRegistry;
        this.toolServerManager = toolServerManager;
    }

    /**
     * Merged catalog for a project, filtered by the role's permissions.
     */
    public List<ToolSpec> getToolDefinitions(ProjectConfig project, ToolPermissions permissions) {
        List<ToolSpec> specs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ToolSpec spec : toolRegistry.specs()) {
            if (seen.add(spec.name())) specs.add(spec);
        }
        for (ToolSpec spec : toolServerManager.specsFor(project)) {
            if (seen.add(spec.name())) {
                specs.add(spec);
            } else {
                log.debug("External tool {} shadowed by in-process handler", spec.name());
            }
        }
        if (permissions == null) return specs;
        specs.removeIf(s -> !permissions.isAllowed(s.name()));
        return specs;
    }

    public boolean hasTool(ProjectConfig project, String name) {
        return toolRegistry.get(name).isPresent() || toolServerManager.toolsFor(project).containsKey(name);
    }

    public ToolResult executeTool(ProjectConfig project, ToolContext ctx, String name, JsonNode args) {
        try {
            var handler = toolRegistry.get(name);
            if (handler.isPresent()) {
                ToolResult result = handler.get().execute(ctx, args);
                return result != null ? result : ToolResult.failure("Tool " + name + " returned no result");
            }
            ToolServerConnection connection = toolServerManager.toolsFor(project).get(name);
            if (connection == null) {
                return ToolResult.failure("Unknown tool: " + name);
            }
            return connection.call(name, args);
        } catch (Exception e) {
            log.warn("Tool {} failed in session {}: {}", name, ctx.sessionId(), e.getMessage());
            return ToolResult.failure("Tool " + name + " failed: " + e.getMessage());
        }
    }
}
