// src/main/java/com/example/procurement/assistantservice/chunk/ChunkBuilder.java
package com.example.procurement.assistantservice.chunk;

import com.example.procurement.assistantservice.model.Chunk;
import com.example.procurement.assistantservice.model.CleanRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns clean records into chunks, one per record, in input order.
 */
public class ChunkBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ChunkBuilder.class);

    private final List<ChunkView> views;

    public ChunkBuilder(List<ChunkView> views) {
        if (views == null || views.size() < 2) {
            throw new IllegalArgumentException("A chunk needs at least two views, got "
                    + (views == null ? 0 : views.size()));
        }
        this.views = List.copyOf(views);
    }

    public List<Chunk> build(List<CleanRecord> records) {
        List<Chunk> chunks = new ArrayList<>(records.size());
        for (CleanRecord record : records) {
            chunks.add(toChunk(record));
        }
        logger.info("Created {} text chunks using views {}", chunks.size(), viewNames());
        return chunks;
    }

    public Chunk toChunk(CleanRecord record) {
        String text = views.stream()
                .map(view -> view.render(record))
                .collect(Collectors.joining(" "));
        return new Chunk(Chunk.idFor(record.rowIndex()), text, metadataOf(record));
    }

    public List<String> viewNames() {
        return views.stream().map(ChunkView::name).toList();
    }

    private static Map<String, Object> metadataOf(CleanRecord record) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(Chunk.COMMODITY, record.commodity());
        metadata.put(Chunk.SUPPLIER, record.supplier());
        metadata.put(Chunk.QUANTITY, record.quantity());
        metadata.put(Chunk.SPEND, record.spend());
        metadata.put(Chunk.PRICE_PER_UNIT, record.pricePerUnit());
        metadata.put(Chunk.ROW_INDEX, record.rowIndex());
        return metadata;
    }
}
