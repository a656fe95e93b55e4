package com.example.procurement.assistantservice.store;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document("index_builds")
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class BuildMarkerDocument {
    public static final String CURRENT = "current";

    @Id
    private String id;
    private String modelId;
    private int dimension;
    private int entryCount;
    private String fingerprint;
    private Instant completedAt;
}
