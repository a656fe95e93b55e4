package com.example.procurement.assistantservice.store;

import com.example.procurement.assistantservice.exception.IndexException;
import com.example.procurement.assistantservice.model.BuildMarker;
import com.example.procurement.assistantservice.model.IndexEntry;
import com.example.procurement.assistantservice.model.RetrievedChunk;
import com.example.procurement.assistantservice.util.VectorMath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local store. Query is a linear scan, fine for tens of thousands of rows.
 */
public class InMemoryVectorStore implements VectorStore {

    private final Map<String, IndexEntry> entries = new LinkedHashMap<>();
    private BuildMarker marker;

    @Override
    public synchronized void addAll(List<IndexEntry> batch) {
        for (IndexEntry entry : batch) {
            if (!entries.isEmpty()) {
                int dimension = entries.values().iterator().next().dimension();
                if (entry.dimension() != dimension) {
                    throw new IndexException("Entry " + entry.id() + " has dimension " + entry.dimension()
                            + ", store holds " + dimension);
                }
            }
            if (entries.putIfAbsent(entry.id(), entry) != null) {
                throw new IndexException("Duplicate entry id " + entry.id());
            }
        }
    }

    @Override
    public synchronized List<RetrievedChunk> query(float[] vector, int k) {
        List<RetrievedChunk> scored = new ArrayList<>(entries.size());
        for (IndexEntry entry : entries.values()) {
            if (entry.dimension() != vector.length) {
                throw new IndexException("Query dimension " + vector.length
                        + " does not match stored dimension " + entry.dimension());
            }
            scored.add(new RetrievedChunk(entry.id(), entry.document(), entry.metadata(),
                    VectorMath.cosine(vector, entry.embedding())));
        }
        // List.sort is stable, so ties keep insertion order
        scored.sort(Comparator.comparingDouble(RetrievedChunk::similarity).reversed());
        return List.copyOf(scored.subList(0, Math.min(k, scored.size())));
    }

    @Override
    public synchronized long count() {
        return entries.size();
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        marker = null;
    }

    @Override
    public synchronized Optional<BuildMarker> readMarker() {
        return Optional.ofNullable(marker);
    }

    @Override
    public synchronized void writeMarker(BuildMarker marker) {
        this.marker = marker;
    }
}
