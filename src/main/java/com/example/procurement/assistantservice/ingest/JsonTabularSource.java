package com.example.procurement.assistantservice.ingest;

import com.example.procurement.assistantservice.exception.DataException;
import com.example.procurement.assistantservice.model.RawRecord;
import com.example.procurement.assistantservice.model.TabularData;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a JSON array of flat objects. The header is the union of field names in
 * the order they are first seen; a field absent from an object reads as null.
 */
public class JsonTabularSource implements TabularSource {

    private static final Logger logger = LoggerFactory.getLogger(JsonTabularSource.class);

    private final Resource resource;
    private final ObjectMapper om = new ObjectMapper();

    public JsonTabularSource(Resource resource) {
        this.resource = resource;
    }

    @Override
    public TabularData read() {
        if (!resource.exists()) {
            throw new DataException("Data file not found: " + description());
        }
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = om.readTree(in);
        } catch (IOException e) {
            throw new DataException("Error loading JSON " + description() + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new DataException("Expected a JSON array of records in " + description());
        }

        Set<String> headers = new LinkedHashSet<>();
        root.elements().forEachRemaining(node -> node.fieldNames().forEachRemaining(headers::add));

        List<RawRecord> rows = new ArrayList<>();
        int rowIndex = 0;
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new DataException("Record " + rowIndex + " in " + description() + " is not an object");
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (String header : headers) {
                values.put(header, asText(node.get(header)));
            }
            rows.add(new RawRecord(rowIndex++, values));
        }
        logger.info("Loaded {} rows from {}", rows.size(), description());
        logger.info("Columns: {}", headers);
        return new TabularData(new ArrayList<>(headers), rows);
    }

    @Override
    public String description() {
        return resource.getDescription();
    }

    private static String asText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        // nested values are not tabular; keep their JSON so numeric coercion rejects them
        return node.toString();
    }
}
