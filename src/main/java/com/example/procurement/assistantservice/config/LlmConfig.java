// src/main/java/com/example/procurement/assistantservice/config/LlmConfig.java
package com.example.procurement.assistantservice.config;

import com.example.procurement.assistantservice.provider.ChatModelFactory;
import com.example.procurement.assistantservice.provider.GenerationProvider;
import com.example.procurement.assistantservice.provider.LangChainGenerationProvider;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmConfig {

    @Bean
    ChatModelFactory chatModelFactory(
            @Value("${openai.apiKey}") String apiKey,
            @Value("${openai.model:gpt-4o-mini}") String model,
            GenerationProperties generation) {
        // the client timeout sits just above the synthesizer's own deadline
        Duration clientTimeout = generation.getTimeout().plusSeconds(5);
        return sampling -> OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(model)
                .temperature(sampling.temperature())
                .topP(sampling.topP())
                .maxTokens(sampling.maxOutputTokens())
                .timeout(clientTimeout)
                .maxRetries(1)
                .build();
    }

    @Bean
    GenerationProvider generationProvider(ChatModelFactory chatModelFactory) {
        return new LangChainGenerationProvider(chatModelFactory);
    }
}
