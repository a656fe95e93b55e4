package com.example.procurement.assistantservice.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the vector store keeps per chunk. The embedding is unit-normalized.
 */
public record IndexEntry(String id, float[] embedding, String document, Map<String, Object> metadata) {

    public IndexEntry {
        embedding = embedding.clone();
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public int dimension() {
        return embedding.length;
    }
}
