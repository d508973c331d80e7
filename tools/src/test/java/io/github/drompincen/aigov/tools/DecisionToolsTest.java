package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.DecisionDocument;
import io.github.drompincen.aigov.persistence.repository.ScoredDecision;
import io.github.drompincen.aigov.runtime.decision.DecisionDraft;
import io.github.drompincen.aigov.runtime.decision.DecisionService;
import io.github.drompincen.aigov.runtime.tools.ToolContext;
import io.github.drompincen.aigov.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DecisionToolsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock private DecisionService decisionService;

    private ToolContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new ToolContext("s1", "proj", "maintainer", "acme/widgets", Path.of("."));
    }

    private static DecisionDocument decision(String id, String projectId, int number) {
        DecisionDocument d = new DecisionDocument();
        d.setId(id);
        d.setProjectId(projectId);
        d.setDecisionNumber(number);
        d.setTitle("Adopt semantic versioning");
        d.setDate(LocalDate.of(2026, 3, 1));
        d.setDecision("All releases follow semver");
        d.setReasoning("Downstream users rely on it");
        d.setDecisionMaker("maintainer");
        return d;
    }

    @Test
    void toolMetadata() throws Exception {
        LogDecisionTool tool = new LogDecisionTool();
        assertThat(tool.name()).isEqualTo("log_decision");
        assertThat(tool.description()).isNotBlank();
        String schema = MAPPER.writeValueAsString(tool.inputSchema());
        assertThat(schema).contains("decision_maker").contains("would_change_if");
        assertThat(tool.inputSchema().get("required")).hasSize(4);
    }

    @Test
    void searchUsesDefaultsAndSessionProject() {
        SearchDecisionsTool tool = new SearchDecisionsTool();
        tool.setDecisionService(decisionService);
        when(decisionService.search("proj", "versioning", 5, 0.7))
                .thenReturn(List.of(new ScoredDecision(decision("d1", "proj", 3), 0.91)));

        ObjectNode input = MAPPER.createObjectNode().put("query", "versioning").put("project_id", "other");
        ToolResult result = tool.execute(ctx, input);

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("query").asText()).isEqualTo("versioning");
        assertThat(result.output().get("results")).hasSize(1);
        assertThat(result.output().at("/results/0/decision/number").asInt()).isEqualTo(3);
        assertThat(result.output().at("/results/0/decision/date").asText()).isEqualTo("2026-03-01");
        assertThat(result.output().at("/results/0/similarity").asDouble()).isEqualTo(0.91);
    }

    @Test
    void searchHonorsExplicitLimitAndThreshold() {
        SearchDecisionsTool tool = new SearchDecisionsTool();
        tool.setDecisionService(decisionService);
        when(decisionService.search(any(), any(), anyInt(), anyDouble())).thenReturn(List.of());

        ObjectNode input = MAPPER.createObjectNode().put("query", "q").put("limit", 2).put("threshold", 0.5);
        ToolResult result = tool.execute(ctx, input);

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("results")).isEmpty();
        verify(decisionService).search("proj", "q", 2, 0.5);
    }

    @Test
    void searchRequiresQuery() {
        SearchDecisionsTool tool = new SearchDecisionsTool();
        tool.setDecisionService(decisionService);
        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode());
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("'query' is required");
    }

    @Test
    void getDecisionReturnsSnakeCaseFields() {
        GetDecisionTool tool = new GetDecisionTool();
        tool.setDecisionService(decisionService);
        when(decisionService.get("d1")).thenReturn(Optional.of(decision("d1", "proj", 7)));

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("decision_id", "d1"));

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("decision_number").asInt()).isEqualTo(7);
        assertThat(result.output().get("decision_maker").asText()).isEqualTo("maintainer");
    }

    @Test
    void getDecisionHidesOtherProjects() {
        GetDecisionTool tool = new GetDecisionTool();
        tool.setDecisionService(decisionService);
        when(decisionService.get("d2")).thenReturn(Optional.of(decision("d2", "elsewhere", 1)));

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("decision_id", "d2"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Decision not found: d2");
    }

    @Test
    void logDecisionDefaultsMakerToRoleAndTagsIt() {
        LogDecisionTool tool = new LogDecisionTool();
        tool.setDecisionService(decisionService);
        when(decisionService.log(eq("proj"), any())).thenReturn(decision("d9", "proj", 12));

        ObjectNode input = MAPPER.createObjectNode()
                .put("title", "Close stale issues")
                .put("decision", "Close after 90 days")
                .put("reasoning", "Backlog hygiene")
                .put("reversibility", "Issues can be reopened");
        ToolResult result = tool.execute(ctx, input);

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("decision_id").asText()).isEqualTo("d9");
        assertThat(result.output().get("decision_number").asInt()).isEqualTo(12);
        assertThat(result.output().get("message").asText()).isEqualTo("Decision #12 logged");

        ArgumentCaptor<DecisionDraft> draft = ArgumentCaptor.forClass(DecisionDraft.class);
        verify(decisionService).log(eq("proj"), draft.capture());
        assertThat(draft.getValue().decisionMaker()).isEqualTo("maintainer");
        assertThat(draft.getValue().reversibility()).isEqualTo("Issues can be reopened");
        assertThat(draft.getValue().considerations()).isNull();
        assertThat(draft.getValue().tags()).containsExactly("log_decision", "maintainer");
    }

    @Test
    void logDecisionRequiresReasoning() {
        LogDecisionTool tool = new LogDecisionTool();
        tool.setDecisionService(decisionService);
        ObjectNode input = MAPPER.createObjectNode().put("title", "t").put("decision", "d");
        ToolResult result = tool.execute(ctx, input);
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("'reasoning' is required");
        verifyNoInteractions(decisionService);
    }

    @Test
    void failsWithoutDecisionService() {
        ToolResult result = new LogDecisionTool().execute(ctx, MAPPER.createObjectNode());
        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("not available");
    }
}
