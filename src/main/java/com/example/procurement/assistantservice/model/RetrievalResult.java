package com.example.procurement.assistantservice.model;

import java.util.List;
import java.util.Map;

/**
 * Ranked hits for one query, highest similarity first.
 */
public record RetrievalResult(String query, List<RetrievedChunk> chunks) {

    public RetrievalResult {
        chunks = List.copyOf(chunks);
    }

    public List<String> contexts() {
        return chunks.stream().map(RetrievedChunk::document).toList();
    }

    public List<Map<String, Object>> metadatas() {
        return chunks.stream().map(RetrievedChunk::metadata).toList();
    }

    public int size() {
        return chunks.size();
    }
}
