package com.example.procurement.assistantservice.index;

import com.example.procurement.assistantservice.exception.EmbeddingException;
import com.example.procurement.assistantservice.exception.IndexException;
import com.example.procurement.assistantservice.model.BuildMarker;
import com.example.procurement.assistantservice.model.Chunk;
import com.example.procurement.assistantservice.model.CleanRecord;
import com.example.procurement.assistantservice.model.IndexEntry;
import com.example.procurement.assistantservice.model.RetrievedChunk;
import com.example.procurement.assistantservice.provider.EmbeddingProvider;
import com.example.procurement.assistantservice.store.InMemoryVectorStore;
import com.example.procurement.assistantservice.support.HashingEmbeddingProvider;
import com.example.procurement.assistantservice.support.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingIndexTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private InMemoryVectorStore store;
    private HashingEmbeddingProvider provider;
    private List<Chunk> chunks;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore();
        provider = new HashingEmbeddingProvider();
        chunks = TestRecords.chunks(
                CleanRecord.of(0, "Sugar", "AcmeCo", 1000, 500),
                CleanRecord.of(1, "Sugar", "SweetCorp", 1000, 800),
                CleanRecord.of(2, "Molasses", "Tereos", 300, 90));
    }

    @Test
    void buildPersistsEveryChunkAndMarksCompletion() {
        EmbeddingIndex index = index(provider, 2);
        assertThat(index.state()).isEqualTo(IndexState.EMPTY);

        index.build(chunks);

        assertThat(index.count()).isEqualTo(3);
        assertThat(index.state()).isEqualTo(IndexState.BUILT);
        BuildMarker marker = index.marker().orElseThrow();
        assertThat(marker.entryCount()).isEqualTo(3);
        assertThat(marker.dimension()).isEqualTo(64);
        assertThat(marker.modelId()).isEqualTo(provider.modelId());
        assertThat(marker.completedAt()).isEqualTo(CLOCK.instant());
        assertThat(store.readMarker()).contains(marker);
    }

    @Test
    void secondBuildIsANoOp() {
        EmbeddingIndex index = index(provider, 16);
        index.build(chunks);
        int embeddedAfterFirstBuild = provider.embeddedTexts();

        index.build(chunks);

        assertThat(index.count()).isEqualTo(3);
        assertThat(provider.embeddedTexts()).isEqualTo(embeddedAfterFirstBuild);
    }

    @Test
    void freshIndexOverCompletedStoreReusesIt() {
        index(provider, 16).build(chunks);

        EmbeddingIndex restarted = index(provider, 16);
        restarted.build(chunks.subList(0, 1));

        assertThat(restarted.state()).isEqualTo(IndexState.BUILT);
        assertThat(restarted.count()).isEqualTo(3);
    }

    @Test
    void leftoversFromCrashedBuildAreClearedAndRebuilt() {
        store.addAll(List.of(new IndexEntry("stale", provider.embed("stale"), "stale", Map.of())));

        EmbeddingIndex index = index(provider, 16);
        index.build(chunks);

        assertThat(index.count()).isEqualTo(3);
        assertThat(index.query(provider.embed("stale"), 10))
                .extracting(RetrievedChunk::id)
                .doesNotContain("stale");
    }

    @Test
    void embeddingFailureWritesNothing() {
        EmbeddingProvider failing = new HashingEmbeddingProvider() {
            @Override
            public List<float[]> embedAll(List<String> texts) {
                if (texts.stream().anyMatch(t -> t.contains("Molasses"))) {
                    throw new EmbeddingException("provider down");
                }
                return super.embedAll(texts);
            }
        };
        EmbeddingIndex index = index(failing, 1);

        assertThatThrownBy(() -> index.build(chunks))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("provider down");
        assertThat(store.count()).isZero();
        assertThat(store.readMarker()).isEmpty();
        assertThat(index.state()).isEqualTo(IndexState.EMPTY);
    }

    @Test
    void storeFailureLeavesNoPartialIndex() {
        InMemoryVectorStore flaky = new InMemoryVectorStore() {
            @Override
            public synchronized void writeMarker(BuildMarker marker) {
                throw new IndexException("disk full");
            }
        };
        EmbeddingIndex index = new EmbeddingIndex(flaky, provider, Runnable::run, 16, CLOCK);

        assertThatThrownBy(() -> index.build(chunks)).isInstanceOf(IndexException.class);
        assertThat(flaky.count()).isZero();
        assertThat(index.state()).isEqualTo(IndexState.EMPTY);
    }

    @Test
    void rebuildReplacesContents() {
        EmbeddingIndex index = index(provider, 16);
        index.build(chunks);

        List<Chunk> replacement = TestRecords.chunks(CleanRecord.of(9, "Salt", "Morton", 10, 3));
        index.rebuild(replacement);

        assertThat(index.count()).isEqualTo(1);
        assertThat(index.query(provider.embed("salt"), 5)).extracting(RetrievedChunk::id).containsExactly("row_9");
    }

    @Test
    void failedRebuildKeepsPreviousIndexQueryable() {
        AtomicInteger calls = new AtomicInteger();
        EmbeddingProvider failsAfterFirstBuild = new HashingEmbeddingProvider() {
            @Override
            public List<float[]> embedAll(List<String> texts) {
                if (calls.incrementAndGet() > 1) {
                    throw new EmbeddingException("provider down");
                }
                return super.embedAll(texts);
            }
        };
        EmbeddingIndex index = index(failsAfterFirstBuild, 16);
        index.build(chunks);
        BuildMarker before = index.marker().orElseThrow();

        List<Chunk> replacement = TestRecords.chunks(CleanRecord.of(9, "Salt", "Morton", 10, 3));
        assertThatThrownBy(() -> index.rebuild(replacement))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("provider down");

        assertThat(index.state()).isEqualTo(IndexState.BUILT);
        assertThat(index.marker()).contains(before);
        assertThat(index.count()).isEqualTo(3);
        assertThat(index.query(provider.embed("Molasses from Tereos"), 1))
                .extracting(RetrievedChunk::id)
                .containsExactly("row_2");
    }

    @Test
    void storeBuiltWithAnotherModelIsRejected() {
        index(new HashingEmbeddingProvider("model-a", 64), 16).build(chunks);

        EmbeddingIndex restarted = index(new HashingEmbeddingProvider("model-b", 64), 16);

        assertThatThrownBy(() -> restarted.build(chunks))
                .isInstanceOf(IndexException.class)
                .hasMessageContaining("model-a")
                .hasMessageContaining("model-b");
        assertThat(restarted.state()).isEqualTo(IndexState.EMPTY);
        assertThat(store.count()).isEqualTo(3);
    }

    @Test
    void rebuildAdoptsNewModel() {
        index(new HashingEmbeddingProvider("model-a", 64), 16).build(chunks);

        EmbeddingIndex restarted = index(new HashingEmbeddingProvider("model-b", 32), 16);
        restarted.rebuild(chunks);

        BuildMarker marker = restarted.marker().orElseThrow();
        assertThat(marker.modelId()).isEqualTo("model-b");
        assertThat(marker.dimension()).isEqualTo(32);
        assertThat(restarted.count()).isEqualTo(3);
    }

    @Test
    void queryBeforeBuildFails() {
        EmbeddingIndex index = index(provider, 16);

        assertThatThrownBy(() -> index.query(provider.embed("sugar"), 3)).isInstanceOf(IndexException.class);
    }

    @Test
    void queryReturnsAtMostKInSimilarityOrder() {
        EmbeddingIndex index = index(provider, 16);
        index.build(chunks);

        List<RetrievedChunk> hits = index.query(provider.embed("Molasses from Tereos"), 2);

        assertThat(hits).hasSize(2);
        assertThat(hits.get(0).id()).isEqualTo("row_2");
        assertThat(hits.get(0).similarity()).isGreaterThanOrEqualTo(hits.get(1).similarity());
    }

    @Test
    void parallelBatchesKeepChunkOrder() {
        EmbeddingIndex index = new EmbeddingIndex(store, provider, ForkJoinPool.commonPool(), 1, CLOCK);

        index.build(chunks);

        for (Chunk chunk : chunks) {
            assertThat(index.query(provider.embed(chunk.text()), 1))
                    .extracting(RetrievedChunk::id)
                    .containsExactly(chunk.id());
        }
    }

    @Test
    void fingerprintDependsOnIdsAndText() {
        String original = EmbeddingIndex.fingerprint(chunks);

        assertThat(EmbeddingIndex.fingerprint(chunks)).isEqualTo(original);
        assertThat(EmbeddingIndex.fingerprint(chunks.subList(0, 2))).isNotEqualTo(original);
    }

    private EmbeddingIndex index(EmbeddingProvider embeddingProvider, int batchSize) {
        Executor direct = Runnable::run;
        return new EmbeddingIndex(store, embeddingProvider, direct, batchSize, CLOCK);
    }
}
