package com.example.procurement.assistantservice.model;

import java.util.List;

public record SpendSummary(
        int totalRecords,
        double totalSpend,
        double totalQuantity,
        double averagePricePerUnit,
        List<String> commodities,
        List<String> suppliers
) {

    public SpendSummary {
        commodities = List.copyOf(commodities);
        suppliers = List.copyOf(suppliers);
    }
}
