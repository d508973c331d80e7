package io.github.drompincen.aigov.runtime.tools.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.aigov.protocol.api.ToolSpec;
import io.github.drompincen.aigov.runtime.tools.ToolResult;

import java.util.List;

/**
 * One live connection to an external tool-protocol server.
 */
public interface ToolServerConnection extends AutoCloseable {

    String serverName();

    /** Tools advertised by the server, enumerated when the connection was made. */
    List<ToolSpec> tools();

    ToolResult call(String toolName, JsonNode arguments);

    @Override
    void close();
}
