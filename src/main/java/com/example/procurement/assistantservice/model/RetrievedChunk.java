package com.example.procurement.assistantservice.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RetrievedChunk(String id, String document, Map<String, Object> metadata, double similarity) {

    public RetrievedChunk {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Cosine distance, {@code 1 - similarity}. */
    public double distance() {
        return 1.0 - similarity;
    }
}
