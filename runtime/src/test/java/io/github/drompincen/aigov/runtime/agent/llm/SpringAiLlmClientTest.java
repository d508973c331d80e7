package io.github.drompincen.aigov.runtime.agent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.aigov.protocol.api.ToolSpec;
import io.github.drompincen.aigov.runtime.error.LlmTimeoutException;
import io.github.drompincen.aigov.runtime.error.LlmUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SpringAiLlmClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private ObjectProvider<ChatModel> chatModelProvider;
    @Mock
    private ChatModel chatModel;

    private SpringAiLlmClient client;

    private SpringAiLlmClient client(Duration timeout) {
        client = new SpringAiLlmClient(chatModelProvider, "anthropic", timeout);
        return client;
    }

    @AfterEach
    void tearDown() {
        if (client != null) client.shutdown();
    }

    private static LlmRequest request(List<LlmMessage> messages) {
        return new LlmRequest("claude-test", 512, "You are the maintainer", messages,
                List.of(new ToolSpec("get_issue", "Get an issue", MAPPER.createObjectNode().put("type", "object"))));
    }

    @Test
    void missingModelIsUnavailable() {
        when(chatModelProvider.getIfAvailable()).thenReturn(null);

        assertThatThrownBy(() -> client(Duration.ofSeconds(5)).complete(request(List.of(LlmMessage.user("hi")))))
                .isInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("anthropic");
    }

    @Test
    void toolCallsBecomeToolUseBlocks() {
        when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
        AssistantMessage output = new AssistantMessage("Let me look", Map.of(), List.of(
                new AssistantMessage.ToolCall("call-1", "function", "get_issue", "{\"issue_number\":7}")));
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of(new Generation(output))));

        LlmResponse response = client(Duration.ofSeconds(5)).complete(request(List.of(LlmMessage.user("triage 7"))));

        assertThat(response.stopReason()).isEqualTo(StopReason.TOOL_USE);
        assertThat(response.text()).isEqualTo("Let me look");
        assertThat(response.toolUses()).hasSize(1);
        assertThat(response.toolUses().get(0).input().path("issue_number").asInt()).isEqualTo(7);
        assertThat(response.model()).isEqualTo("claude-test");
    }

    @Test
    void historyIsTranslatedWithSystemFirst() {
        when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("done")))));
        List<LlmMessage> history = List.of(
                LlmMessage.user("triage 7"),
                LlmMessage.assistant(List.of(new ToolUseBlock("call-1", "get_issue", MAPPER.createObjectNode()))),
                LlmMessage.user(List.of(new ToolResultBlock("call-1", "get_issue", "issue body", false))));

        client(Duration.ofSeconds(5)).complete(request(history));

        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());
        List<Message> messages = prompt.getValue().getInstructions();
        assertThat(messages).extracting(Message::getMessageType).containsExactly(
                MessageType.SYSTEM, MessageType.USER, MessageType.ASSISTANT, MessageType.TOOL);
        assertThat(((AssistantMessage) messages.get(2)).getToolCalls()).hasSize(1);
    }

    @Test
    void slowModelTimesOut() {
        when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
        when(chatModel.call(any(Prompt.class))).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return null;
        });

        assertThatThrownBy(() -> client(Duration.ofMillis(100)).complete(request(List.of(LlmMessage.user("hi")))))
                .isInstanceOf(LlmTimeoutException.class);
    }

    @Test
    void providerFailureIsUnavailable() {
        when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("401 unauthorized"));

        assertThatThrownBy(() -> client(Duration.ofSeconds(5)).complete(request(List.of(LlmMessage.user("hi")))))
                .isInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("401 unauthorized");
    }

    @Test
    void stopReasonMapping() {
        assertThat(SpringAiLlmClient.stopReasonOf(true, "stop")).isEqualTo(StopReason.TOOL_USE);
        assertThat(SpringAiLlmClient.stopReasonOf(false, null)).isEqualTo(StopReason.END_TURN);
        assertThat(SpringAiLlmClient.stopReasonOf(false, "LENGTH")).isEqualTo(StopReason.MAX_TOKENS);
        assertThat(SpringAiLlmClient.stopReasonOf(false, "max_tokens")).isEqualTo(StopReason.MAX_TOKENS);
        assertThat(SpringAiLlmClient.stopReasonOf(false, "stop_sequence")).isEqualTo(StopReason.STOP_SEQUENCE);
        assertThat(SpringAiLlmClient.stopReasonOf(false, "end_turn")).isEqualTo(StopReason.END_TURN);
    }
}
