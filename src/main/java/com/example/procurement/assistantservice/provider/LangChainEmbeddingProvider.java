package com.example.procurement.assistantservice.provider;

import com.example.procurement.assistantservice.exception.EmbeddingException;
import com.example.procurement.assistantservice.util.VectorMath;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}. Vectors are
 * L2-normalized here, so cosine similarity reduces to a dot product downstream.
 */
public class LangChainEmbeddingProvider implements EmbeddingProvider {

    private static final Logger logger = LoggerFactory.getLogger(LangChainEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;
    private final String modelId;

    public LangChainEmbeddingProvider(EmbeddingModel embeddingModel, String modelName) {
        this.embeddingModel = embeddingModel;
        this.modelId = modelName + "+l2";
    }

    @Override
    public String modelId() {
        return modelId;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        Response<Embedding> response;
        try {
            response = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        }
        if (response == null || response.content() == null) {
            throw new EmbeddingException("Embedding model returned no vector");
        }
        return normalized(response.content());
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
        Response<List<Embedding>> response;
        try {
            response = embeddingModel.embedAll(segments);
        } catch (RuntimeException e) {
            throw new EmbeddingException("Batch embedding request failed: " + e.getMessage(), e);
        }
        List<Embedding> embeddings = response == null ? null : response.content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new EmbeddingException("Expected " + texts.size() + " embeddings, got "
                    + (embeddings == null ? 0 : embeddings.size()));
        }
        List<float[]> out = new ArrayList<>(embeddings.size());
        for (Embedding e : embeddings) {
            out.add(normalized(e));
        }
        logger.debug("Embedded batch of {} texts with {}", texts.size(), modelId);
        return out;
    }

    private static float[] normalized(Embedding embedding) {
        try {
            return VectorMath.normalize(embedding.vector());
        } catch (IllegalArgumentException e) {
            throw new EmbeddingException("Embedding model returned an unusable vector", e);
        }
    }
}
