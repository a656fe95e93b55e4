package com.example.procurement.assistantservice.ingest;

import com.example.procurement.assistantservice.exception.DataException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.nio.file.Path;
import java.util.Locale;

public final class TabularSources {

    private static final String CLASSPATH_PREFIX = "classpath:";

    private TabularSources() {
    }

    /**
     * Picks a reader by file extension. Supports {@code classpath:} locations in
     * addition to filesystem paths.
     */
    public static TabularSource forLocation(String location) {
        if (location == null || location.isBlank()) {
            throw new DataException("No data location configured. Set app.data.path");
        }
        Resource resource;
        if (location.startsWith(CLASSPATH_PREFIX)) {
            resource = new ClassPathResource(location.substring(CLASSPATH_PREFIX.length()));
        } else {
            resource = new FileSystemResource(Path.of(location).toAbsolutePath().normalize());
        }

        String lower = location.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".csv")) {
            return new CsvTabularSource(resource);
        }
        if (lower.endsWith(".json")) {
            return new JsonTabularSource(resource);
        }
        throw new DataException("Unsupported data file type (expected .csv or .json): " + location);
    }
}
