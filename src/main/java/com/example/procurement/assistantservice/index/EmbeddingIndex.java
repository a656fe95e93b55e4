package com.example.procurement.assistantservice.index;

import com.example.procurement.assistantservice.exception.EmbeddingException;
import com.example.procurement.assistantservice.exception.IndexException;
import com.example.procurement.assistantservice.model.BuildMarker;
import com.example.procurement.assistantservice.model.Chunk;
import com.example.procurement.assistantservice.model.IndexEntry;
import com.example.procurement.assistantservice.model.RetrievedChunk;
import com.example.procurement.assistantservice.provider.EmbeddingProvider;
import com.example.procurement.assistantservice.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the vector store and decides when a build is needed.
 * <p>
 * Completion is tracked with an explicit {@link BuildMarker} written after the last
 * entry is persisted. A store that holds entries but no marker is the remains of
 * a crashed build and is cleared before building again. Builds are all-or-nothing:
 * every vector is computed before the existing contents are touched, so a failed
 * embedding leaves the previous index in place, and a failed write clears the store.
 * <p>
 * Queries take the read lock and rebuilds the write lock, so a reader sees either
 * the complete old index or the complete new one.
 */
@Component
public class EmbeddingIndex {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingIndex.class);

    private final VectorStore store;
    private final EmbeddingProvider embeddingProvider;
    private final Executor executor;
    private final int batchSize;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile BuildMarker marker;

    @Autowired
    public EmbeddingIndex(VectorStore store,
                          EmbeddingProvider embeddingProvider,
                          @Qualifier("indexingExecutor") Executor executor,
                          @Value("${app.index.batch-size:16}") int batchSize) {
        this(store, embeddingProvider, executor, batchSize, Clock.systemUTC());
    }

    EmbeddingIndex(VectorStore store, EmbeddingProvider embeddingProvider, Executor executor,
                   int batchSize, Clock clock) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.executor = executor;
        this.batchSize = batchSize;
        this.clock = clock;
    }

    /**
     * Builds the index unless the store already holds a completed build.
     *
     * @throws EmbeddingException if any chunk cannot be embedded; nothing is written
     * @throws IndexException     if the store fails, or holds vectors from a different
     *                            embedding model
     */
    public void build(List<Chunk> chunks) {
        lock.writeLock().lock();
        try {
            String fingerprint = fingerprint(chunks);
            Optional<BuildMarker> existing = store.readMarker();
            if (existing.isPresent()) {
                BuildMarker found = existing.get();
                if (!found.modelId().equals(embeddingProvider.modelId())) {
                    throw new IndexException("Index was built with " + found.modelId()
                            + " but the embedding model is now " + embeddingProvider.modelId()
                            + "; a rebuild is required (app.index.force-rebuild=true)");
                }
                if (!found.fingerprint().equals(fingerprint)) {
                    logger.warn("Existing index ({} entries) was built from different input; "
                                    + "keeping it until an explicit rebuild is requested",
                            found.entryCount());
                }
                logger.info("Index already built with {} entries at {} (skipping embedding)",
                        found.entryCount(), found.completedAt());
                marker = found;
                return;
            }
            long leftover = store.count();
            if (leftover > 0) {
                logger.warn("Store holds {} entries but no completed build; clearing before rebuilding", leftover);
            }
            doBuild(chunks, fingerprint, leftover > 0);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the current index with one built from {@code chunks}. Concurrent
     * queries block until the new index is complete. If embedding fails the
     * current index stays in place.
     */
    public void rebuild(List<Chunk> chunks) {
        lock.writeLock().lock();
        try {
            logger.info("Forced rebuild requested; replacing {} entries", store.count());
            doBuild(chunks, fingerprint(chunks), true);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<RetrievedChunk> query(float[] vector, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0");
        }
        lock.readLock().lock();
        try {
            if (marker == null) {
                throw new IndexException("Index has not been built");
            }
            return store.query(vector, k);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long count() {
        return store.count();
    }

    public IndexState state() {
        return marker == null ? IndexState.EMPTY : IndexState.BUILT;
    }

    public Optional<BuildMarker> marker() {
        return Optional.ofNullable(marker);
    }

    private void doBuild(List<Chunk> chunks, String fingerprint, boolean replaceExisting) {
        if (chunks.isEmpty()) {
            logger.warn("Building an empty index: no chunks were supplied");
        } else {
            logger.info("Embedding {} chunks in batches of {}...", chunks.size(), batchSize);
        }
        List<float[]> vectors = embedAll(chunks.stream().map(Chunk::text).toList());
        int dimension = vectors.isEmpty() ? 0 : vectors.get(0).length;

        List<IndexEntry> entries = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            entries.add(new IndexEntry(chunk.id(), vectors.get(i), chunk.text(), chunk.metadata()));
        }

        BuildMarker completed = new BuildMarker(embeddingProvider.modelId(), dimension, entries.size(),
                fingerprint, Instant.now(clock));
        try {
            if (replaceExisting) {
                marker = null;
                store.clear();
            }
            store.addAll(entries);
            store.writeMarker(completed);
        } catch (RuntimeException e) {
            discardPartialBuild(e);
            if (e instanceof IndexException ie) {
                throw ie;
            }
            throw new IndexException("Failed to persist index: " + e.getMessage(), e);
        }
        marker = completed;
        logger.info("Successfully embedded and stored {} documents ({} dimensions)", entries.size(), dimension);
    }

    private List<float[]> embedAll(List<String> texts) {
        List<CompletableFuture<List<float[]>>> batches = new ArrayList<>();
        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> batch = texts.subList(start, Math.min(texts.size(), start + batchSize));
            batches.add(CompletableFuture.supplyAsync(() -> embedBatch(batch), executor));
        }
        try {
            CompletableFuture.allOf(batches.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof EmbeddingException ee) {
                throw ee;
            }
            throw new EmbeddingException("Embedding failed during index build: " + cause.getMessage(), cause);
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        for (CompletableFuture<List<float[]>> batch : batches) {
            vectors.addAll(batch.join());
        }
        if (!vectors.isEmpty()) {
            int dimension = vectors.get(0).length;
            for (float[] v : vectors) {
                if (v.length != dimension) {
                    throw new EmbeddingException("Embedding provider returned mixed dimensions: "
                            + dimension + " and " + v.length);
                }
            }
        }
        return vectors;
    }

    private List<float[]> embedBatch(List<String> batch) {
        List<float[]> vectors = embeddingProvider.embedAll(batch);
        if (vectors.size() != batch.size()) {
            throw new EmbeddingException("Expected " + batch.size() + " embeddings, got " + vectors.size());
        }
        return vectors;
    }

    private void discardPartialBuild(RuntimeException failure) {
        try {
            store.clear();
        } catch (RuntimeException clearFailure) {
            failure.addSuppressed(clearFailure);
            logger.error("Could not clear partially written index", clearFailure);
        }
    }

    static String fingerprint(List<Chunk> chunks) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (Chunk chunk : chunks) {
            digest.update(chunk.id().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(chunk.text().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
