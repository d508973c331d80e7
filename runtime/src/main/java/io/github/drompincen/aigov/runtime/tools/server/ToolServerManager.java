package io.github.drompincen.aigov.runtime.tools.server;

import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.protocol.api.ToolServerConfig;
import io.github.drompincen.aigov.protocol.api.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the external tool-server connections of every project, one connection per configured
 * server, made on first use. A project whose server list changed is reconnected from scratch;
 * servers that failed to connect are retried once {@code retryAfter} has passed.
 */
@Component
public class ToolServerManager {

    private static final Logger log = LoggerFactory.getLogger(ToolServerManager.class);

    private final ToolServerConnectionFactory connectionFactory;
    private final Clock clock;
    private final Duration retryAfter;
    private final Map<String, ProjectTools> byProject = new ConcurrentHashMap<>();

    public ToolServerManager(ToolServerConnectionFactory connectionFactory, Clock clock,
                             @Value("${aigov.tool-servers.retry-after:PT1M}") Duration retryAfter) {
        this.connectionFactory = connectionFactory;
        this.clock = clock;
        this.retryAfter = retryAfter;
    }

    /** Tool name to owning connection, honouring each server's include/exclude filters. */
    public Map<String, ToolServerConnection> toolsFor(ProjectConfig project) {
        return current(project).routes();
    }

    /** Specs of the external tools of a project, in server then tool order. */
    public List<ToolSpec> specsFor(ProjectConfig project) {
        return current(project).specs();
    }

    public void disconnect(String projectId) {
        ProjectTools tools = byProject.remove(projectId);
        if (tools != null) tools.close();
    }

    @PreDestroy
    public void shutdown() {
        byProject.keySet().forEach(this::disconnect);
    }

    private ProjectTools current(ProjectConfig project) {
        return byProject.compute(project.id(), (id, existing) -> {
            if (existing == null) {
                return connectAll(project, Map.of());
            }
            if (!existing.servers().equals(project.toolServers())) {
                log.info("Tool servers of project {} changed, reconnecting", id);
                existing.close();
                return connectAll(project, Map.of());
            }
            if (!existing.failed().isEmpty() && !clock.instant().isBefore(existing.connectedAt().plus(retryAfter))) {
                log.info("Retrying tool servers {} of project {}", existing.failed(), id);
                return connectAll(project, existing.byServer());
            }
            return existing;
        });
    }

    private ProjectTools connectAll(ProjectConfig project, Map<String, ToolServerConnection> open) {
        Map<String, ToolServerConnection> byServer = new LinkedHashMap<>();
        Map<String, ToolServerConnection> routes = new LinkedHashMap<>();
        List<ToolSpec> specs = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (ToolServerConfig config : project.toolServers()) {
            ToolServerConnection connection = open.get(config.name());
            if (connection == null) {
                try {
                    connection = connectionFactory.connect(config);
                } catch (Exception e) {
                    log.warn("Tool server {} of project {} failed to connect, its tools are unavailable: {}",
                            config.name(), project.id(), e.getMessage());
                    failed.add(config.name());
                    continue;
                }
            }
            byServer.put(config.name(), connection);
            for (ToolSpec spec : connection.tools()) {
                if (!config.exposes(spec.name())) continue;
                if (routes.putIfAbsent(spec.name(), connection) == null) {
                    specs.add(spec);
                } else {
                    log.warn("Tool {} of server {} shadowed by an earlier server", spec.name(), config.name());
                }
            }
        }
        return new ProjectTools(project.toolServers(), clock.instant(), Collections.unmodifiableMap(byServer),
                Collections.unmodifiableMap(routes), List.copyOf(specs), List.copyOf(failed));
    }

    private record ProjectTools(List<ToolServerConfig> servers,
                                Instant connectedAt,
                                Map<String, ToolServerConnection> byServer,
                                Map<String, ToolServerConnection> routes,
                                List<ToolSpec> specs,
                                List<String> failed) {
        void close() {
            for (ToolServerConnection connection : byServer.values()) {
                try {
                    connection.close();
                } catch (Exception e) {
                    log.warn("Failed to close tool server {}: {}", connection.serverName(), e.getMessage());
                }
            }
        }
    }
}
