package io.github.drompincen.aigov.runtime.tools.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.protocol.api.ToolServerConfig;
import io.github.drompincen.aigov.protocol.api.ToolSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ToolServerManagerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private ToolServerConnectionFactory factory;
    @Mock
    private ToolServerConnection github;
    @Mock
    private ToolServerConnection ci;
    @Mock
    private Clock clock;

    private ToolServerManager manager;

    private final ToolServerConfig githubConfig = new ToolServerConfig("github", ToolServerConfig.Transport.STDIO,
            "github-mcp", List.of(), Map.of(), null, List.of(), List.of("delete_repo"));
    private final ToolServerConfig ciConfig = new ToolServerConfig("ci", ToolServerConfig.Transport.HTTP,
            null, List.of(), Map.of(), "http://localhost:9000/mcp", List.of(), List.of());
    private final ToolServerConfig brokenConfig = new ToolServerConfig("broken", ToolServerConfig.Transport.STDIO,
            "missing", List.of(), Map.of(), null, List.of(), List.of());

    @BeforeEach
    void setUp() {
        manager = new ToolServerManager(factory, clock, Duration.ofMinutes(1));
        when(clock.instant()).thenReturn(T0);
        when(github.serverName()).thenReturn("github");
        when(github.tools()).thenReturn(List.of(spec("get_issue"), spec("delete_repo")));
        when(ci.serverName()).thenReturn("ci");
        when(ci.tools()).thenReturn(List.of(spec("get_issue"), spec("run_pipeline")));
        when(factory.connect(githubConfig)).thenReturn(github);
        when(factory.connect(ciConfig)).thenReturn(ci);
        when(factory.connect(brokenConfig)).thenThrow(new IllegalStateException("no such command"));
    }

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static ToolSpec spec(String name) {
        return new ToolSpec(name, name, MAPPER.createObjectNode());
    }

    private ProjectConfig project(ToolServerConfig... servers) {
        return new ProjectConfig("proj", "Project", "acme/widgets", "", List.of(), Map.of(), List.of(servers), null);
    }

    @Test
    void firstServerOwnsDuplicateToolsAndExcludesAreHidden() {
        ProjectConfig project = project(githubConfig, ciConfig);

        assertThat(manager.specsFor(project)).extracting(ToolSpec::name).containsExactly("get_issue", "run_pipeline");
        assertThat(manager.toolsFor(project)).containsEntry("get_issue", github).containsEntry("run_pipeline", ci)
                .doesNotContainKey("delete_repo");
    }

    @Test
    void failingServerIsSkipped() {
        ProjectConfig project = project(brokenConfig, ciConfig);

        assertThat(manager.toolsFor(project)).containsOnlyKeys("get_issue", "run_pipeline");
    }

    @Test
    void connectsOncePerProjectAndClosesOnDisconnect() {
        ProjectConfig project = project(githubConfig);

        manager.toolsFor(project);
        manager.specsFor(project);
        manager.disconnect("proj");

        verify(factory, times(1)).connect(githubConfig);
        verify(github).close();
    }

    @Test
    void changedServerListReconnectsAndClosesRemovedServers() {
        manager.toolsFor(project(githubConfig, ciConfig));

        Map<String, ToolServerConnection> routes = manager.toolsFor(project(ciConfig));

        assertThat(routes).containsOnlyKeys("get_issue", "run_pipeline").containsEntry("get_issue", ci);
        verify(github).close();
        verify(ci).close();
        verify(factory, times(2)).connect(ciConfig);
    }

    @Test
    void failedServerIsRetriedAfterDelayWithoutReconnectingHealthyOnes() {
        ProjectConfig project = project(brokenConfig, ciConfig);
        manager.toolsFor(project);

        when(clock.instant()).thenReturn(T0.plusSeconds(30));
        manager.toolsFor(project);
        verify(factory, times(1)).connect(brokenConfig);

        ToolServerConnection recovered = mock(ToolServerConnection.class);
        when(recovered.tools()).thenReturn(List.of(spec("restart")));
        doReturn(recovered).when(factory).connect(brokenConfig);
        when(clock.instant()).thenReturn(T0.plusSeconds(61));

        assertThat(manager.toolsFor(project)).containsOnlyKeys("restart", "get_issue", "run_pipeline");
        verify(factory, times(2)).connect(brokenConfig);
        verify(factory, times(1)).connect(ciConfig);
        verify(ci, never()).close();
    }
}
