package com.example.procurement.assistantservice.provider;

import com.example.procurement.assistantservice.exception.EmbeddingException;

import java.util.List;

/**
 * Turns text into unit-length vectors of a fixed dimension. Indexing and query
 * embedding must go through the same provider, otherwise similarities are meaningless.
 */
public interface EmbeddingProvider {

    /** Identifies the model (and normalization) behind the vectors. */
    String modelId();

    /**
     * @throws EmbeddingException if the provider is unavailable
     */
    float[] embed(String text);

    /**
     * One vector per input text, in input order.
     *
     * @throws EmbeddingException if the provider is unavailable or returns a short batch
     */
    List<float[]> embedAll(List<String> texts);
}
