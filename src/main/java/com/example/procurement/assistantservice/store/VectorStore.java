package com.example.procurement.assistantservice.store;

import com.example.procurement.assistantservice.exception.IndexException;
import com.example.procurement.assistantservice.model.BuildMarker;
import com.example.procurement.assistantservice.model.IndexEntry;
import com.example.procurement.assistantservice.model.RetrievedChunk;

import java.util.List;
import java.util.Optional;

/**
 * Durable id → (vector, document, metadata) storage with cosine nearest-neighbour
 * query. Implementations raise {@link IndexException} when the backing store is
 * unreachable or corrupt.
 */
public interface VectorStore {

    void addAll(List<IndexEntry> entries);

    /**
     * Top {@code k} entries by cosine similarity, highest first. Entries with equal
     * similarity come back in insertion order.
     */
    List<RetrievedChunk> query(float[] vector, int k);

    long count();

    /** Removes every entry and the build marker. */
    void clear();

    Optional<BuildMarker> readMarker();

    void writeMarker(BuildMarker marker);
}
