package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.LlmInteractionDocument;
import io.github.drompincen.aigov.persistence.repository.LlmInteractionRepository;
import io.github.drompincen.aigov.runtime.tools.*;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates LLM calls over a trailing window. Scoped to the session's project when there is one.
 */
public class GetLlmMetricsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_HOURS = 24;
    private LlmInteractionRepository llmInteractionRepository;
    private Clock clock = Clock.systemUTC();

    @Override public String name() { return "get_llm_metrics"; }
    @Override public String description() { return "Summarize LLM usage over the last N hours: calls, failures, tokens and latency"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("hours").put("type", "integer").put("description", "Window in hours (default 24)");
        props.putObject("project_id").put("type", "string").put("description", "Only this project (optional)");
        return schema;
    }

    public void setLlmInteractionRepository(LlmInteractionRepository llmInteractionRepository) {
        this.llmInteractionRepository = llmInteractionRepository;
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (llmInteractionRepository == null) return ToolResult.failure("LLM interaction log not available");
        int hours = input.path("hours").asInt(DEFAULT_HOURS);
        if (hours <= 0) return ToolResult.failure("'hours' must be positive");
        String projectId = ToolInputs.projectId(ctx, input);

        List<LlmInteractionDocument> calls = llmInteractionRepository
                .findByTimestampAfterOrderByTimestampDesc(clock.instant().minus(Duration.ofHours(hours)));

        long count = 0, failures = 0, promptTokens = 0, completionTokens = 0, totalDuration = 0;
        Map<String, Integer> byModel = new TreeMap<>();
        for (LlmInteractionDocument call : calls) {
            if (projectId != null && !projectId.equals(call.getProjectId())) continue;
            count++;
            if (!call.isSuccess()) failures++;
            promptTokens += call.getPromptTokens();
            completionTokens += call.getCompletionTokens();
            totalDuration += call.getDurationMs();
            if (call.getModel() != null) byModel.merge(call.getModel(), 1, Integer::sum);
        }

        ObjectNode result = MAPPER.createObjectNode();
        result.put("hours", hours);
        result.put("total_calls", count);
        result.put("failures", failures);
        result.put("prompt_tokens", promptTokens);
        result.put("completion_tokens", completionTokens);
        result.put("total_tokens", promptTokens + completionTokens);
        result.put("avg_duration_ms", count == 0 ? 0 : totalDuration / count);
        ObjectNode models = result.putObject("calls_by_model");
        byModel.forEach(models::put);
        return ToolResult.success(result);
    }
}
