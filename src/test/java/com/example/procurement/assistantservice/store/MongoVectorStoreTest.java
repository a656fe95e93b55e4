package com.example.procurement.assistantservice.store;

import com.example.procurement.assistantservice.exception.IndexException;
import com.example.procurement.assistantservice.model.BuildMarker;
import com.example.procurement.assistantservice.model.IndexEntry;
import com.example.procurement.assistantservice.model.RetrievedChunk;
import com.example.procurement.assistantservice.repo.BuildMarkerRepository;
import com.example.procurement.assistantservice.repo.ChunkRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoVectorStoreTest {

    @Mock
    private ChunkRepository repo;

    @Mock
    private BuildMarkerRepository markerRepo;

    @Captor
    private ArgumentCaptor<List<IndexedChunk>> captor;

    private MongoVectorStore store;

    @BeforeEach
    void setUp() {
        store = new MongoVectorStore(repo, markerRepo);
    }

    @Test
    void addAllPersistsEntriesWithPositions() {
        when(repo.count()).thenReturn(2L);

        store.addAll(List.of(
                new IndexEntry("row_0", new float[]{1, 0}, "doc 0", Map.of("supplier", "AcmeCo")),
                new IndexEntry("row_1", new float[]{0, 1}, "doc 1", Map.of("supplier", "SweetCorp"))));

        verify(repo).saveAll(captor.capture());
        assertThat(captor.getValue()).extracting(IndexedChunk::getId, IndexedChunk::getPosition)
                .containsExactly(
                        tuple("row_0", 2L),
                        tuple("row_1", 3L));
        assertThat(captor.getValue().get(0).getEmbedding()).containsExactly(1.0, 0.0);
    }

    @Test
    void queryRanksStoredEmbeddings() {
        when(repo.findAllByOrderByPositionAsc()).thenReturn(List.of(
                chunk("row_0", 0, List.of(0.0, 1.0)),
                chunk("row_1", 1, List.of(1.0, 0.0)),
                chunk("row_2", 2, List.of(0.6, 0.8))));

        List<RetrievedChunk> hits = store.query(new float[]{1, 0}, 2);

        assertThat(hits).extracting(RetrievedChunk::id).containsExactly("row_1", "row_2");
    }

    @Test
    void markerRoundTripsThroughDocument() {
        BuildMarker marker = new BuildMarker("model", 2, 3, "abc", Instant.parse("2024-01-01T00:00:00Z"));
        ArgumentCaptor<BuildMarkerDocument> markerCaptor = ArgumentCaptor.forClass(BuildMarkerDocument.class);

        store.writeMarker(marker);

        verify(markerRepo).save(markerCaptor.capture());
        assertThat(markerCaptor.getValue().getId()).isEqualTo(BuildMarkerDocument.CURRENT);
        when(markerRepo.findById(BuildMarkerDocument.CURRENT)).thenReturn(Optional.of(markerCaptor.getValue()));
        assertThat(store.readMarker()).contains(marker);
    }

    @Test
    void clearDeletesMarkerBeforeEntries() {
        store.clear();

        var order = inOrder(markerRepo, repo);
        order.verify(markerRepo).deleteAll();
        order.verify(repo).deleteAll();
    }

    @Test
    void unreachableStoreIsAnIndexError() {
        when(repo.count()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(store::count)
                .isInstanceOf(IndexException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void failedSaveIsAnIndexError() {
        when(repo.count()).thenReturn(0L);
        when(repo.saveAll(any())).thenThrow(new DataAccessResourceFailureException("timeout"));

        assertThatThrownBy(() -> store.addAll(List.of(new IndexEntry("row_0", new float[]{1}, "d", Map.of()))))
                .isInstanceOf(IndexException.class);
    }

    private static IndexedChunk chunk(String id, long position, List<Double> embedding) {
        return IndexedChunk.builder()
                .id(id)
                .position(position)
                .text("doc " + id)
                .embedding(embedding)
                .metadata(Map.of("id", id))
                .build();
    }
}
