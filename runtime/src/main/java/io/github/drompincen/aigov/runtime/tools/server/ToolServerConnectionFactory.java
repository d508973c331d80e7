package io.github.drompincen.aigov.runtime.tools.server;

import io.github.drompincen.aigov.protocol.api.ToolServerConfig;

public interface ToolServerConnectionFactory {

    /**
     * Connects, initializes and enumerates the server's tools.
     *
     * @throws RuntimeException when the server cannot be reached or initialized
     */
    ToolServerConnection connect(ToolServerConfig config);
}
