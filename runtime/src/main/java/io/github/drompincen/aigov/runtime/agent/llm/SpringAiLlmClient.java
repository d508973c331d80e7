package io.github.drompincen.aigov.runtime.agent.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.aigov.runtime.error.LlmTimeoutException;
import io.github.drompincen.aigov.runtime.error.LlmUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

/**
 * {@link LlmClient} over a Spring AI {@link ChatModel}. Tool execution inside Spring AI is disabled;
 * tool calls come back as {@link ToolUseBlock}s. Every call is bounded by {@code aigov.llm.timeout}.
 */
@Service
public class SpringAiLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiLlmClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectProvider<ChatModel> chatModel;
    private final String provider;
    private final Duration timeout;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "llm-call");
        t.setDaemon(true);
        return t;
    });

    public SpringAiLlmClient(ObjectProvider<ChatModel> chatModel,
                             @Value("${aigov.llm.provider:anthropic}") String provider,
                             @Value("${aigov.llm.timeout:PT2M}") Duration timeout) {
        this.chatModel = chatModel;
        this.provider = provider;
        this.timeout = timeout;
    }

    @Override
    public String provider() {
        return provider;
    }

    @Override
    public LlmResponse complete(LlmRequest request) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            throw new LlmUnavailableException("No chat model configured for provider '" + provider
                    + "'; set the provider API key");
        }
        Prompt prompt = toPrompt(request);
        Future<ChatResponse> future = executor.submit(() -> model.call(prompt));
        ChatResponse response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LlmTimeoutException(timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmUnavailableException("Interrupted while waiting for the LLM", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new LlmUnavailableException("LLM call failed: " + cause.getMessage(), cause);
        }
        return fromResponse(response, request.model());
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    Prompt toPrompt(LlmRequest request) {
        List<Message> messages = new ArrayList<>();
        if (request.system() != null && !request.system().isBlank()) {
            messages.add(new SystemMessage(request.system()));
        }
        for (LlmMessage message : request.messages()) {
            messages.addAll(toMessages(message));
        }
        List<ToolCallback> callbacks = request.tools().stream()
                .map(DefinitionOnlyToolCallback::new)
                .collect(Collectors.toList());
        ChatOptions options = ToolCallingChatOptions.builder()
                .toolCallbacks(callbacks)
                .internalToolExecutionEnabled(false)
                .model(request.model())
                .maxTokens(request.maxTokens() > 0 ? request.maxTokens() : null)
                .build();
        return new Prompt(messages, options);
    }

    private static List<Message> toMessages(LlmMessage message) {
        List<Message> out = new ArrayList<>();
        String text = message.content().stream()
                .filter(b -> b instanceof TextBlock)
                .map(b -> ((TextBlock) b).text())
                .collect(Collectors.joining("\n"));

        if (message.role() == LlmMessage.Role.ASSISTANT) {
            List<AssistantMessage.ToolCall> calls = message.content().stream()
                    .filter(b -> b instanceof ToolUseBlock)
                    .map(b -> (ToolUseBlock) b)
                    .map(b -> new AssistantMessage.ToolCall(b.id(), "function", b.name(),
                            b.input() != null ? b.input().toString() : "{}"))
                    .collect(Collectors.toList());
            out.add(new AssistantMessage(text, Map.of(), calls));
            return out;
        }

        List<ToolResponseMessage.ToolResponse> responses = message.content().stream()
                .filter(b -> b instanceof ToolResultBlock)
                .map(b -> (ToolResultBlock) b)
                .map(b -> new ToolResponseMessage.ToolResponse(b.toolUseId(), b.toolName(), b.content()))
                .collect(Collectors.toList());
        if (!responses.isEmpty()) out.add(new ToolResponseMessage(responses));
        if (!text.isEmpty()) out.add(new UserMessage(text));
        return out;
    }

    private static LlmResponse fromResponse(ChatResponse response, String requestedModel) {
        List<ContentBlock> blocks = new ArrayList<>();
        String finishReason = null;
        for (Generation generation : response.getResults()) {
            AssistantMessage output = generation.getOutput();
            if (output.getText() != null && !output.getText().isBlank()) {
                blocks.add(new TextBlock(output.getText()));
            }
            for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                blocks.add(new ToolUseBlock(call.id(), call.name(), parseArguments(call.arguments())));
            }
            if (generation.getMetadata() != null && generation.getMetadata().getFinishReason() != null) {
                finishReason = generation.getMetadata().getFinishReason();
            }
        }
        boolean toolUse = blocks.stream().anyMatch(b -> b instanceof ToolUseBlock);
        ChatResponseMetadata metadata = response.getMetadata();
        Usage usage = Usage.NONE;
        String model = requestedModel;
        if (metadata != null) {
            if (metadata.getUsage() != null) {
                usage = new Usage(orZero(metadata.getUsage().getPromptTokens()),
                        orZero(metadata.getUsage().getCompletionTokens()));
            }
            if (metadata.getModel() != null && !metadata.getModel().isBlank()) model = metadata.getModel();
        }
        return new LlmResponse(blocks, stopReasonOf(toolUse, finishReason), usage, model);
    }

    static StopReason stopReasonOf(boolean toolUse, String finishReason) {
        if (toolUse) return StopReason.TOOL_USE;
        if (finishReason == null) return StopReason.END_TURN;
        return switch (finishReason.toLowerCase()) {
            case "max_tokens", "length" -> StopReason.MAX_TOKENS;
            case "stop_sequence" -> StopReason.STOP_SEQUENCE;
            case "tool_use", "tool_calls" -> StopReason.TOOL_USE;
            default -> StopReason.END_TURN;
        };
    }

    private static JsonNode parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) return MAPPER.createObjectNode();
        try {
            return MAPPER.readTree(arguments);
        } catch (Exception e) {
            log.warn("Tool call arguments are not valid JSON, passing them as text: {}", e.getMessage());
            return MAPPER.getNodeFactory().textNode(arguments);
        }
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
