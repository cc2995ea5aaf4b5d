package com.privacygraph.main.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Model clients for embeddings and graph extraction
 */
@Slf4j
@Configuration
public class AiConfig {

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingModel embeddingModel(PrivacyGraphProperties properties) {
        PrivacyGraphProperties.Ai ai = properties.getAi();
        log.info("Creating Ollama embedding model '{}' at {}", ai.getEmbeddingModel(), ai.getBaseUrl());
        return OllamaEmbeddingModel.builder()
                .baseUrl(ai.getBaseUrl())
                .modelName(ai.getEmbeddingModel())
                .timeout(ai.getTimeout())
                .maxRetries(ai.getMaxRetries())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChatModel chatModel(PrivacyGraphProperties properties) {
        PrivacyGraphProperties.Ai ai = properties.getAi();
        log.info("Creating Ollama chat model '{}' at {}", ai.getChatModel(), ai.getBaseUrl());
        return OllamaChatModel.builder()
                .baseUrl(ai.getBaseUrl())
                .modelName(ai.getChatModel())
                .temperature(0.0)
                .timeout(ai.getTimeout())
                .maxRetries(ai.getMaxRetries())
                .build();
    }
}
