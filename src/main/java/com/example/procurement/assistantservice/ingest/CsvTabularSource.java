package com.example.procurement.assistantservice.ingest;

import com.example.procurement.assistantservice.exception.DataException;
import com.example.procurement.assistantservice.model.RawRecord;
import com.example.procurement.assistantservice.model.TabularData;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a CSV file whose first line is the header. Cells are kept as raw strings;
 * empty cells and cells missing from short lines become null.
 */
public class CsvTabularSource implements TabularSource {

    private static final Logger logger = LoggerFactory.getLogger(CsvTabularSource.class);

    private final Resource resource;
    private final CsvMapper mapper;

    public CsvTabularSource(Resource resource) {
        this.resource = resource;
        this.mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.WRAP_AS_ARRAY)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
    }

    @Override
    public TabularData read() {
        if (!resource.exists()) {
            throw new DataException("Data file not found: " + description());
        }
        // decode ourselves so a leading BOM survives into the header and is stripped by the normalizer
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             MappingIterator<List<String>> it = mapper.readerForListOf(String.class).readValues(reader)) {
            if (!it.hasNext()) {
                throw new DataException("Data file is empty: " + description());
            }
            List<String> headers = it.next();
            List<RawRecord> rows = new ArrayList<>();
            int rowIndex = 0;
            while (it.hasNext()) {
                List<String> cells = it.next();
                rows.add(new RawRecord(rowIndex++, toRow(headers, cells)));
            }
            logger.info("Loaded {} rows from {}", rows.size(), description());
            logger.info("Columns: {}", headers);
            return new TabularData(headers, rows);
        } catch (DataException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DataException("Error loading CSV " + description() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String description() {
        return resource.getDescription();
    }

    private static Map<String, String> toRow(List<String> headers, List<String> cells) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String cell = i < cells.size() ? cells.get(i) : null;
            row.put(headers.get(i), cell == null || cell.isEmpty() ? null : cell);
        }
        return row;
    }
}
