package io.github.drompincen.aigov.runtime.tools.server;

import io.github.drompincen.aigov.protocol.api.ToolServerConfig;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class McpToolServerConnectionFactoryTest {

    private final ToolServerConfig stdio = new ToolServerConfig("github", ToolServerConfig.Transport.STDIO,
            "github-mcp", List.of(), Map.of(), null, List.of(), List.of());

    private McpToolServerConnectionFactory factoryFor(McpSyncClient client) {
        return new McpToolServerConnectionFactory(Duration.ofSeconds(5)) {
            @Override
            McpSyncClient newClient(McpClientTransport transport) {
                return client;
            }
        };
    }

    @Test
    void failedHandshakeClosesClient() {
        McpSyncClient client = mock(McpSyncClient.class);
        when(client.initialize()).thenThrow(new IllegalStateException("server exited"));
        when(client.closeGracefully()).thenReturn(true);

        assertThatThrownBy(() -> factoryFor(client).connect(stdio))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("server exited");
        verify(client).closeGracefully();
    }

    @Test
    void failedToolListingClosesClient() {
        McpSyncClient client = mock(McpSyncClient.class);
        when(client.listTools()).thenThrow(new IllegalStateException("timeout"));
        when(client.closeGracefully()).thenReturn(false);

        assertThatThrownBy(() -> factoryFor(client).connect(stdio)).hasMessage("timeout");
        verify(client).closeGracefully();
    }

    @Test
    void successfulConnectKeepsClientOpen() {
        McpSyncClient client = mock(McpSyncClient.class);
        when(client.listTools()).thenReturn(new McpSchema.ListToolsResult(List.of(), null));

        ToolServerConnection connection = factoryFor(client).connect(stdio);

        assertThat(connection.serverName()).isEqualTo("github");
        assertThat(connection.tools()).isEmpty();
        verify(client, never()).closeGracefully();
    }

    @Test
    void httpServerWithoutUrlIsRejected() {
        ToolServerConfig http = new ToolServerConfig("ci", ToolServerConfig.Transport.HTTP,
                null, List.of(), Map.of(), " ", List.of(), List.of());

        assertThatThrownBy(() -> new McpToolServerConnectionFactory(Duration.ofSeconds(5)).connect(http))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Tool server ci has no url");
    }
}
