package com.example.procurement.assistantservice.service;

import com.example.procurement.assistantservice.index.EmbeddingIndex;
import com.example.procurement.assistantservice.model.Answer;
import com.example.procurement.assistantservice.model.Chunk;
import com.example.procurement.assistantservice.model.ConversationTurn;
import com.example.procurement.assistantservice.model.RetrievalResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * The two operations the host calls: build the index once, then answer questions
 * against it. Stateless between calls; history comes in with each question.
 */
@Service
@RequiredArgsConstructor
public class AssistantPipeline {

    private static final Logger logger = LoggerFactory.getLogger(AssistantPipeline.class);

    private final EmbeddingIndex index;
    private final Retriever retriever;
    private final PromptComposer promptComposer;
    private final AnswerSynthesizer answerSynthesizer;

    public void buildIndex(List<Chunk> chunks) {
        index.build(chunks);
    }

    public void rebuildIndex(List<Chunk> chunks) {
        index.rebuild(chunks);
    }

    /**
     * Retrieves, composes and synthesizes. Generation failures come back as a
     * degraded answer; retrieval failures propagate.
     */
    public Answer answer(String query, List<ConversationTurn> history) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        logger.info("New query: {}", query);
        RetrievalResult retrieval = retriever.retrieve(query);
        String prompt = promptComposer.compose(query, retrieval.contexts(), retrieval.metadatas(),
                history == null ? List.of() : history);
        return answerSynthesizer.synthesize(prompt, retrieval);
    }

    public EmbeddingIndex index() {
        return index;
    }
}
