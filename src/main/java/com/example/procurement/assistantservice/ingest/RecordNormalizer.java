package com.example.procurement.assistantservice.ingest;

import com.example.procurement.assistantservice.config.DataProperties;
import com.example.procurement.assistantservice.exception.DataException;
import com.example.procurement.assistantservice.model.CleanRecord;
import com.example.procurement.assistantservice.model.RawRecord;
import com.example.procurement.assistantservice.model.TabularData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates raw rows and turns the survivors into {@link CleanRecord}s.
 * <p>
 * A row is dropped when any required field is missing or blank, when quantity or
 * spend is not a plain finite number, or when quantity is not strictly positive.
 * Surviving rows keep their original row index.
 */
@Component
public class RecordNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(RecordNormalizer.class);

    private static final char BOM = '\uFEFF';

    private final DataProperties.Columns columns;

    public RecordNormalizer(DataProperties properties) {
        this.columns = properties.getColumns();
    }

    public List<CleanRecord> normalize(TabularData data) {
        Map<String, String> byCleanName = resolveColumns(data.headers());

        String commodityCol = byCleanName.get(columns.getCommodity());
        String supplierCol = byCleanName.get(columns.getSupplier());
        String quantityCol = byCleanName.get(columns.getQuantity());
        String spendCol = byCleanName.get(columns.getSpend());

        List<CleanRecord> clean = new ArrayList<>();
        int dropped = 0;
        for (RawRecord row : data.rows()) {
            String commodity = trimToNull(row.get(commodityCol));
            String supplier = trimToNull(row.get(supplierCol));
            Double quantity = toNumber(row.get(quantityCol));
            Double spend = toNumber(row.get(spendCol));

            if (commodity == null || supplier == null || quantity == null || spend == null || quantity <= 0) {
                logger.debug("Dropping row {}: {}", row.rowIndex(), row.values());
                dropped++;
                continue;
            }
            clean.add(CleanRecord.of(row.rowIndex(), commodity, supplier, quantity, spend));
        }

        logger.info("Cleaned data: {} rows ({} dropped)", clean.size(), dropped);
        return clean;
    }

    /**
     * Maps each cleaned header name to the raw header it came from, and fails if a
     * required column is absent.
     */
    private Map<String, String> resolveColumns(List<String> headers) {
        Map<String, String> byCleanName = new HashMap<>();
        for (String raw : headers) {
            if (raw != null) {
                byCleanName.putIfAbsent(cleanColumnName(raw), raw);
            }
        }
        List<String> missing = columns.required().stream()
                .filter(name -> !byCleanName.containsKey(name))
                .toList();
        if (!missing.isEmpty()) {
            throw new DataException("Required column(s) missing from source: " + missing
                    + " (found " + byCleanName.keySet() + ")");
        }
        return byCleanName;
    }

    static String cleanColumnName(String raw) {
        return raw.replace(String.valueOf(BOM), "").strip();
    }

    static Double toNumber(String raw) {
        String value = trimToNull(raw);
        if (value == null) {
            return null;
        }
        try {
            double parsed = new BigDecimal(value).doubleValue();
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String trimToNull(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
