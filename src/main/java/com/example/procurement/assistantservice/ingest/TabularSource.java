package com.example.procurement.assistantservice.ingest;

import com.example.procurement.assistantservice.exception.DataException;
import com.example.procurement.assistantservice.model.TabularData;

/**
 * A source of raw procurement rows with a header.
 */
public interface TabularSource {

    /**
     * Reads every row. Row indexes are zero-based positions among the data rows
     * (the header is not counted).
     *
     * @throws DataException if the source cannot be read
     */
    TabularData read();

    /** Human-readable location, for logs and error messages. */
    String description();
}
