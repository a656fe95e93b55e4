// src/main/java/com/example/procurement/assistantservice/model/Chunk.java
package com.example.procurement.assistantservice.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Atomic retrievable unit derived from one {@link CleanRecord}.
 */
public record Chunk(String id, String text, Map<String, Object> metadata) {

    public static final String ID_PREFIX = "row_";

    public static final String COMMODITY = "commodity";
    public static final String SUPPLIER = "supplier";
    public static final String QUANTITY = "quantity";
    public static final String SPEND = "spend";
    public static final String PRICE_PER_UNIT = "price_per_unit";
    public static final String ROW_INDEX = "row_index";

    public Chunk {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static String idFor(int rowIndex) {
        return ID_PREFIX + rowIndex;
    }
}
