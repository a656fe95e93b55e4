package com.example.procurement.assistantservice.service;

import com.example.procurement.assistantservice.model.ConversationTurn;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Builds the generation prompt. Output depends only on the arguments.
 */
@Component
public class PromptComposer {

    static final int HISTORY_TURNS = 3;

    private static final String INSTRUCTIONS = """
            INSTRUCTIONS:
            1. Answer based ONLY on the provided context
            2. Be specific with numbers (quantities, spend, suppliers, commodities)
            3. Format numbers clearly with currency and units (e.g., $1,234.56, 1,000 kg)
            4. If the context doesn't have the information needed, say so explicitly
            5. Be concise but complete
            """;

    private final String domainDescription;

    public PromptComposer(@Value("${app.assistant.domain-description:commodity spend data}") String domainDescription) {
        this.domainDescription = domainDescription;
    }

    /**
     * @param query     the user's question
     * @param contexts  retrieved chunk texts, best match first
     * @param metadatas metadata for each context, same order and size
     * @param history   earlier turns, oldest first; may be null or empty
     */
    public String compose(String query,
                          List<String> contexts,
                          List<Map<String, Object>> metadatas,
                          List<ConversationTurn> history) {
        if (metadatas != null && metadatas.size() != contexts.size()) {
            throw new IllegalArgumentException("Got " + contexts.size() + " contexts but "
                    + metadatas.size() + " metadata entries");
        }

        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an AI assistant analyzing ").append(domainDescription)
                .append(". Answer the user's question accurately using ONLY the provided context.\n\n");

        if (history != null && !history.isEmpty()) {
            prompt.append("Previous conversation:\n");
            for (ConversationTurn turn : history.subList(Math.max(0, history.size() - HISTORY_TURNS), history.size())) {
                prompt.append(turn.role()).append(": ")
                        .append(turn.content() == null ? "" : turn.content())
                        .append('\n');
            }
            prompt.append('\n');
        }

        prompt.append("CONTEXT INFORMATION:\n");
        if (contexts.isEmpty()) {
            prompt.append("(no matching records were found)\n");
        }
        for (int i = 0; i < contexts.size(); i++) {
            prompt.append("Context ").append(i + 1).append(": ").append(contexts.get(i)).append("\n\n");
        }

        prompt.append('\n').append(INSTRUCTIONS).append('\n');
        prompt.append("USER QUESTION: ").append(query).append("\n\n");
        prompt.append("ANSWER:");
        return prompt.toString();
    }
}
