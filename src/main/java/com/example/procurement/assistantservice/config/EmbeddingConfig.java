// src/main/java/com/example/procurement/assistantservice/config/EmbeddingConfig.java
package com.example.procurement.assistantservice.config;

import com.example.procurement.assistantservice.provider.EmbeddingProvider;
import com.example.procurement.assistantservice.provider.LangChainEmbeddingProvider;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EmbeddingConfig {

    @Bean
    EmbeddingModel embeddingModel(
            @Value("${openai.apiKey}") String apiKey,
            @Value("${openai.embeddingModel:text-embedding-3-small}") String model,
            @Value("${openai.embeddingTimeout:60s}") Duration timeout
    ) {
        return OpenAiEmbeddingModel.builder()
                .apiKey(apiKey)
                .modelName(model)
                .timeout(timeout)
                .build();
    }

    @Bean
    EmbeddingProvider embeddingProvider(
            EmbeddingModel embeddingModel,
            @Value("${openai.embeddingModel:text-embedding-3-small}") String model) {
        return new LangChainEmbeddingProvider(embeddingModel, model);
    }
}
