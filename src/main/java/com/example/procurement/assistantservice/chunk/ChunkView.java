package com.example.procurement.assistantservice.chunk;

import com.example.procurement.assistantservice.model.CleanRecord;

import java.util.function.Function;

/**
 * One natural-language perspective on a record. A chunk's text is the
 * concatenation of several views, so differently worded questions land near
 * the same record in embedding space.
 */
public interface ChunkView {

    String name();

    String render(CleanRecord record);

    static ChunkView of(String name, Function<CleanRecord, String> renderer) {
        return new ChunkView() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String render(CleanRecord record) {
                return renderer.apply(record);
            }

            @Override
            public String toString() {
                return "ChunkView[" + name + "]";
            }
        };
    }
}
