package com.example.procurement.assistantservice.model;

import java.time.Instant;

/**
 * Written once a build has persisted every entry. Its absence means the store
 * holds no finished index, whatever {@code count()} reports.
 *
 * @param modelId     embedding model the vectors were computed with
 * @param dimension   vector dimension, 0 for an empty index
 * @param entryCount  number of entries persisted
 * @param fingerprint SHA-256 over chunk ids and texts, in order
 * @param completedAt when the build finished
 */
public record BuildMarker(
        String modelId,
        int dimension,
        int entryCount,
        String fingerprint,
        Instant completedAt
) {
}
