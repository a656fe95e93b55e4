package com.example.procurement.assistantservice.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row as ingested. Values are keyed by the column name exactly as it appeared
 * in the source header (BOM and padding included) and may be null.
 */
public record RawRecord(int rowIndex, Map<String, String> values) {

    public RawRecord {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String get(String column) {
        return values.get(column);
    }
}
