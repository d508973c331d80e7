package io.github.drompincen.aigov.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chat and embedding models. Exactly one chat model exists, for {@code aigov.llm.provider}, and only
 * when that provider's key is set; without it the LLM capability is unavailable and invocations fail.
 * The embedding model needs the OpenAI key; without it decision search degrades to no results.
 */
@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    @ConditionalOnExpression("'${aigov.llm.provider:anthropic}' == 'anthropic' and '${spring.ai.anthropic.api-key:}' != ''")
    ChatModel anthropicChatModel(@Value("${spring.ai.anthropic.api-key}") String apiKey,
                                 @Value("${aigov.llm.default-model:claude-sonnet-4-5-20250929}") String model,
                                 @Value("${aigov.llm.default-max-tokens:8192}") int maxTokens) {
        log.info("Using Anthropic chat model {}", model);
        AnthropicApi api = AnthropicApi.builder().apiKey(apiKey).build();
        AnthropicChatOptions options = AnthropicChatOptions.builder()
                .model(model)
                .maxTokens(maxTokens)
                .build();
        return AnthropicChatModel.builder().anthropicApi(api).defaultOptions(options).build();
    }

    @Bean
    @ConditionalOnExpression("'${aigov.llm.provider:anthropic}' == 'openai' and '${spring.ai.openai.api-key:}' != ''")
    ChatModel openAiChatModel(@Value("${spring.ai.openai.api-key}") String apiKey,
                              @Value("${aigov.llm.default-model:gpt-4o}") String model) {
        log.info("Using OpenAI chat model {}", model);
        OpenAiApi api = OpenAiApi.builder().apiKey(apiKey).build();
        OpenAiChatOptions options = OpenAiChatOptions.builder().model(model).build();
        return OpenAiChatModel.builder().openAiApi(api).defaultOptions(options).build();
    }

    @Bean
    @ConditionalOnExpression("'${spring.ai.openai.api-key:}' != ''")
    EmbeddingModel embeddingModel(@Value("${spring.ai.openai.api-key}") String apiKey,
                                  @Value("${aigov.embedding.model:text-embedding-3-small}") String model) {
        OpenAiApi api = OpenAiApi.builder().apiKey(apiKey).build();
        OpenAiEmbeddingOptions options = OpenAiEmbeddingOptions.builder().model(model).build();
        return new OpenAiEmbeddingModel(api, MetadataMode.EMBED, options);
    }
}
