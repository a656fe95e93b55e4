package com.example.procurement.assistantservice.provider;

import com.example.procurement.assistantservice.model.SamplingConfig;
import dev.langchain4j.model.chat.ChatLanguageModel;

/**
 * Builds a chat model bound to one sampling configuration.
 */
@FunctionalInterface
public interface ChatModelFactory {

    ChatLanguageModel create(SamplingConfig sampling);
}
