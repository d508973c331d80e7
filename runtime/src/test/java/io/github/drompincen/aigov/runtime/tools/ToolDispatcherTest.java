package io.github.drompincen.aigov.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.protocol.api.ToolPermissions;
import io.github.drompincen.aigov.protocol.api.ToolSpec;
import io.github.drompincen.aigov.runtime.tools.server.ToolServerConnection;
import io.github.drompincen.aigov.runtime.tools.server.ToolServerManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationContext;

import java.util.List;
import java.util.Map;

import static io.github.drompincen.aigov.runtime.GovernanceFixtures.project;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ToolDispatcherTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private ToolServerManager toolServerManager;
    @Mock
    private ToolServerConnection github;

    private ToolRegistry registry;
    private ToolDispatcher dispatcher;
    private final ProjectConfig project = project();
    private final ToolContext ctx = new ToolContext("s-1", "proj", "maintainer", "acme/widgets", null);

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry(mock(ApplicationContext.class));
        dispatcher = new ToolDispatcher(registry, toolServerManager);
        registry.register(inProcess("get_decision", ToolResult.success(new TextNode("local"))));
        when(toolServerManager.specsFor(project)).thenReturn(List.of(
                new ToolSpec("get_decision", "remote duplicate", MAPPER.createObjectNode()),
                new ToolSpec("get_issue", "Get an issue", MAPPER.createObjectNode()),
                new ToolSpec("merge_pull_request", "Merge", MAPPER.createObjectNode())));
        when(toolServerManager.toolsFor(project)).thenReturn(Map.of(
                "get_decision", github, "get_issue", github, "merge_pull_request", github));
    }

    private static Tool inProcess(String name, ToolResult result) {
        return new Tool() {
            @Override public String name() { return name; }
            @Override public String description() { return "local " + name; }
            @Override public JsonNode inputSchema() { return MAPPER.createObjectNode(); }
            @Override public ToolResult execute(ToolContext ctx, JsonNode input) { return result; }
        };
    }

    @Test
    void inProcessToolWinsNameCollision() {
        List<ToolSpec> specs = dispatcher.getToolDefinitions(project, null);

        assertThat(specs).extracting(ToolSpec::name).containsExactly("get_decision", "get_issue", "merge_pull_request");
        assertThat(specs.get(0).description()).isEqualTo("local get_decision");

        ToolResult result = dispatcher.executeTool(project, ctx, "get_decision", MAPPER.createObjectNode());
        assertThat(result.output().asText()).isEqualTo("local");
        verify(github, never()).call(any(), any());
    }

    @Test
    void catalogIsFilteredByPermissions() {
        List<ToolSpec> specs = dispatcher.getToolDefinitions(project,
                new ToolPermissions(List.of(), List.of("merge_pull_request")));

        assertThat(specs).extracting(ToolSpec::name).doesNotContain("merge_pull_request");
    }

    @Test
    void externalToolIsCalledOnOwningServer() {
        JsonNode args = MAPPER.createObjectNode().put("issue_number", 4);
        when(github.call("get_issue", args)).thenReturn(ToolResult.success(new TextNode("issue 4")));

        ToolResult result = dispatcher.executeTool(project, ctx, "get_issue", args);

        assertThat(result.success()).isTrue();
        assertThat(dispatcher.hasTool(project, "get_issue")).isTrue();
    }

    @Test
    void unknownToolIsAFailureResult() {
        ToolResult result = dispatcher.executeTool(project, ctx, "launch_rockets", MAPPER.createObjectNode());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Unknown tool: launch_rockets");
        assertThat(dispatcher.hasTool(project, "launch_rockets")).isFalse();
    }

    @Test
    void executionNeverThrows() {
        when(github.call(any(), any())).thenThrow(new IllegalStateException("server went away"));
        registry.register(inProcess("log_decision", null));

        assertThat(dispatcher.executeTool(project, ctx, "merge_pull_request", MAPPER.createObjectNode()).error())
                .isEqualTo("Tool merge_pull_request failed: server went away");
        assertThat(dispatcher.executeTool(project, ctx, "log_decision", MAPPER.createObjectNode()).error())
                .isEqualTo("Tool log_decision returned no result");
    }
}
