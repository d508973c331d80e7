package io.github.drompincen.aigov.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * An external tool-protocol server reachable over a subprocess (stdio) or HTTP transport.
 */
public record ToolServerConfig(
        String name,
        Transport type,
        String command,
        List<String> args,
        Map<String, String> env,
        String url,
        List<String> include,
        List<String> exclude
) {
    public enum Transport {
        @JsonProperty("stdio") STDIO,
        @JsonProperty("http") HTTP
    }

    public ToolServerConfig {
        args = args != null ? List.copyOf(args) : List.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        include = include != null ? List.copyOf(include) : List.of();
        exclude = exclude != null ? List.copyOf(exclude) : List.of();
    }

    public boolean exposes(String toolName) {
        if (exclude.contains(toolName)) return false;
        return include.isEmpty() || include.contains(toolName);
    }
}
