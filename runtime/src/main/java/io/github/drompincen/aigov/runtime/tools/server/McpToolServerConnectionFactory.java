package io.github.drompincen.aigov.runtime.tools.server;

import io.github.drompincen.aigov.protocol.api.ToolServerConfig;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class McpToolServerConnectionFactory implements ToolServerConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(McpToolServerConnectionFactory.class);

    private final Duration requestTimeout;

    public McpToolServerConnectionFactory(
            @Value("${aigov.tool-servers.request-timeout:PT30S}") Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ToolServerConnection connect(ToolServerConfig config) {
        McpSyncClient client = newClient(transportFor(config));
        McpToolServerConnection connection;
        try {
            client.initialize();
            connection = new McpToolServerConnection(config.name(), client);
        } catch (RuntimeException e) {
            // a stdio server would otherwise keep running
            if (!client.closeGracefully()) {
                log.warn("Tool server {} did not close after a failed connect", config.name());
            }
            throw e;
        }
        log.info("Connected tool server {} ({}) with {} tools", config.name(), config.type(),
                connection.tools().size());
        return connection;
    }

    McpSyncClient newClient(McpClientTransport transport) {
        return McpClient.sync(transport)
                .requestTimeout(requestTimeout)
                .clientInfo(new McpSchema.Implementation("aigov", "0.1.0"))
                .build();
    }

    McpClientTransport transportFor(ToolServerConfig config) {
        if (config.type() == ToolServerConfig.Transport.HTTP) {
            if (config.url() == null || config.url().isBlank()) {
                throw new IllegalArgumentException("Tool server " + config.name() + " has no url");
            }
            return HttpClientSseClientTransport.builder(config.url()).build();
        }
        if (config.command() == null || config.command().isBlank()) {
            throw new IllegalArgumentException("Tool server " + config.name() + " has no command");
        }
        ServerParameters params = ServerParameters.builder(config.command())
                .args(config.args())
                .env(config.env())
                .build();
        return new StdioClientTransport(params);
    }
}
