package com.example.procurement.assistantservice.bootstrap;

import com.example.procurement.assistantservice.model.Answer;
import com.example.procurement.assistantservice.model.ConversationTurn;
import com.example.procurement.assistantservice.model.SpendSummary;
import com.example.procurement.assistantservice.service.AssistantPipeline;

import java.util.List;

/**
 * Everything a request handler needs, created once at startup after the index is
 * built and never modified afterwards.
 *
 * @param pipeline   the query pipeline over the built index
 * @param summary    aggregate figures over the clean records
 * @param chunkCount number of chunks produced from the source data
 * @param source     where the records were read from
 */
public record AssistantContext(AssistantPipeline pipeline, SpendSummary summary, int chunkCount, String source) {

    public Answer answer(String query, List<ConversationTurn> history) {
        return pipeline.answer(query, history);
    }
}
