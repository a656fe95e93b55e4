package com.example.procurement.assistantservice.provider;

import com.example.procurement.assistantservice.exception.GenerationException;
import com.example.procurement.assistantservice.model.SamplingConfig;
import dev.langchain4j.model.chat.ChatLanguageModel;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link GenerationProvider} over LangChain4j chat models. LangChain4j fixes sampling
 * parameters at build time, so one model is kept per distinct {@link SamplingConfig}.
 */
public class LangChainGenerationProvider implements GenerationProvider {

    private final ChatModelFactory modelFactory;
    private final Map<SamplingConfig, ChatLanguageModel> models = new ConcurrentHashMap<>();

    public LangChainGenerationProvider(ChatModelFactory modelFactory) {
        this.modelFactory = modelFactory;
    }

    @Override
    public String generate(String prompt, SamplingConfig sampling) {
        ChatLanguageModel chatModel = models.computeIfAbsent(sampling, modelFactory::create);
        try {
            return chatModel.generate(prompt);
        } catch (RuntimeException e) {
            throw new GenerationException("Generation request failed: " + e.getMessage(), e);
        }
    }
}
