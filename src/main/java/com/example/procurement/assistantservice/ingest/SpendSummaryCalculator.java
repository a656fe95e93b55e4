package com.example.procurement.assistantservice.ingest;

import com.example.procurement.assistantservice.model.CleanRecord;
import com.example.procurement.assistantservice.model.SpendSummary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Aggregate figures over the clean records, for dashboards and health checks.
 */
@Component
public class SpendSummaryCalculator {

    public SpendSummary summarize(List<CleanRecord> records) {
        double totalSpend = 0;
        double totalQuantity = 0;
        double priceSum = 0;
        for (CleanRecord r : records) {
            totalSpend += r.spend();
            totalQuantity += r.quantity();
            priceSum += r.pricePerUnit();
        }
        double averagePrice = records.isEmpty() ? 0.0 : priceSum / records.size();
        return new SpendSummary(
                records.size(),
                totalSpend,
                totalQuantity,
                averagePrice,
                records.stream().map(CleanRecord::commodity).toList(),
                records.stream().map(CleanRecord::supplier).toList());
    }
}
