// src/main/java/com/example/procurement/assistantservice/service/Retriever.java
package com.example.procurement.assistantservice.service;

import com.example.procurement.assistantservice.exception.EmbeddingException;
import com.example.procurement.assistantservice.exception.IndexException;
import com.example.procurement.assistantservice.index.EmbeddingIndex;
import com.example.procurement.assistantservice.model.BuildMarker;
import com.example.procurement.assistantservice.model.RetrievalResult;
import com.example.procurement.assistantservice.model.RetrievedChunk;
import com.example.procurement.assistantservice.provider.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Embeds a question with the indexing provider and returns the nearest chunks.
 * No filtering or re-ranking beyond the store's cosine ranking.
 */
@Service
public class Retriever {

    private static final Logger logger = LoggerFactory.getLogger(Retriever.class);

    private final EmbeddingIndex index;
    private final EmbeddingProvider embeddingProvider;
    private final int defaultTopK;

    public Retriever(EmbeddingIndex index,
                     EmbeddingProvider embeddingProvider,
                     @Value("${app.retrieval.top-k:30}") int defaultTopK) {
        this.index = index;
        this.embeddingProvider = embeddingProvider;
        this.defaultTopK = defaultTopK;
    }

    public RetrievalResult retrieve(String queryText) {
        return retrieve(queryText, defaultTopK);
    }

    /**
     * @throws EmbeddingException if the query cannot be embedded, or the provider
     *                            differs from the one the index was built with
     * @throws IndexException     if the index is not built or the store fails
     */
    public RetrievalResult retrieve(String queryText, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0");
        }
        BuildMarker marker = index.marker()
                .orElseThrow(() -> new IndexException("Index has not been built"));
        if (!marker.modelId().equals(embeddingProvider.modelId())) {
            throw new EmbeddingException("Index was built with " + marker.modelId()
                    + " but queries are embedded with " + embeddingProvider.modelId());
        }

        float[] vector = embeddingProvider.embed(queryText);
        if (marker.dimension() > 0 && vector.length != marker.dimension()) {
            throw new EmbeddingException("Query embedding has dimension " + vector.length
                    + ", index expects " + marker.dimension());
        }

        List<RetrievedChunk> hits = index.query(vector, k);
        logger.info("Retrieved {} relevant chunks for '{}'", hits.size(), queryText);
        if (logger.isDebugEnabled()) {
            logger.debug("Similarity scores: {}", hits.stream()
                    .map(h -> String.format(Locale.ROOT, "%.3f", h.similarity()))
                    .toList());
        }
        return new RetrievalResult(queryText, hits);
    }

    public int defaultTopK() {
        return defaultTopK;
    }
}
