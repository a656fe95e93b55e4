// src/main/java/com/example/procurement/assistantservice/store/MongoVectorStore.java
package com.example.procurement.assistantservice.store;

import com.example.procurement.assistantservice.exception.IndexException;
import com.example.procurement.assistantservice.model.BuildMarker;
import com.example.procurement.assistantservice.model.IndexEntry;
import com.example.procurement.assistantservice.model.RetrievedChunk;
import com.example.procurement.assistantservice.repo.BuildMarkerRepository;
import com.example.procurement.assistantservice.repo.ChunkRepository;
import com.example.procurement.assistantservice.util.VectorMath;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * MongoDB-backed store. Entries live in {@code chunks}, the build marker in
 * {@code index_builds}. Ranking computes cosine in Java against all embeddings.
 */
@RequiredArgsConstructor
public class MongoVectorStore implements VectorStore {

    private final ChunkRepository repo;
    private final BuildMarkerRepository markerRepo;

    @Override
    public void addAll(List<IndexEntry> entries) {
        long position;
        try {
            position = repo.count();
        } catch (DataAccessException e) {
            throw new IndexException("Vector store unreachable: " + e.getMessage(), e);
        }
        List<IndexedChunk> toSave = new ArrayList<>(entries.size());
        for (IndexEntry entry : entries) {
            toSave.add(IndexedChunk.builder()
                    .id(entry.id())
                    .position(position++)
                    .text(entry.document())
                    .embedding(VectorMath.toList(entry.embedding()))
                    .metadata(entry.metadata())
                    .build());
        }
        try {
            repo.saveAll(toSave);
        } catch (DataAccessException e) {
            throw new IndexException("Failed to persist " + toSave.size() + " entries: " + e.getMessage(), e);
        }
    }

    @Override
    public List<RetrievedChunk> query(float[] vector, int k) {
        List<IndexedChunk> all;
        try {
            all = repo.findAllByOrderByPositionAsc();
        } catch (DataAccessException e) {
            throw new IndexException("Vector store unreachable: " + e.getMessage(), e);
        }
        return all.stream()
                .map(c -> new RetrievedChunk(
                        c.getId(),
                        c.getText(),
                        c.getMetadata() == null ? Map.of() : c.getMetadata(),
                        similarity(vector, c)))
                .sorted(Comparator.comparingDouble(RetrievedChunk::similarity).reversed())
                .limit(k)
                .collect(Collectors.toList());
    }

    @Override
    public long count() {
        try {
            return repo.count();
        } catch (DataAccessException e) {
            throw new IndexException("Vector store unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public void clear() {
        try {
            // marker first, so a crash in between never leaves a marker over an emptied store
            markerRepo.deleteAll();
            repo.deleteAll();
        } catch (DataAccessException e) {
            throw new IndexException("Failed to clear vector store: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<BuildMarker> readMarker() {
        try {
            return markerRepo.findById(BuildMarkerDocument.CURRENT)
                    .map(d -> new BuildMarker(d.getModelId(), d.getDimension(), d.getEntryCount(),
                            d.getFingerprint(), d.getCompletedAt()));
        } catch (DataAccessException e) {
            throw new IndexException("Vector store unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public void writeMarker(BuildMarker marker) {
        try {
            markerRepo.save(BuildMarkerDocument.builder()
                    .id(BuildMarkerDocument.CURRENT)
                    .modelId(marker.modelId())
                    .dimension(marker.dimension())
                    .entryCount(marker.entryCount())
                    .fingerprint(marker.fingerprint())
                    .completedAt(marker.completedAt())
                    .build());
        } catch (DataAccessException e) {
            throw new IndexException("Failed to write build marker: " + e.getMessage(), e);
        }
    }

    private static double similarity(float[] query, IndexedChunk chunk) {
        if (chunk.getEmbedding() == null || chunk.getEmbedding().size() != query.length) {
            throw new IndexException("Stored entry " + chunk.getId() + " has a missing or mismatched embedding");
        }
        return VectorMath.cosine(query, VectorMath.toFloatArray(chunk.getEmbedding()));
    }
}
