// src/main/java/com/example/procurement/assistantservice/store/IndexedChunk.java
package com.example.procurement.assistantservice.store;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;
import java.util.Map;

@Document("chunks")
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class IndexedChunk {
    @Id
    private String id;                    // chunk id, e.g. row_12
    private long position;                // insertion order, used for tie-breaking
    private String text;                  // chunk document
    private List<Double> embedding;       // unit-normalized vector
    private Map<String, Object> metadata; // commodity, supplier, spend, ...
}
