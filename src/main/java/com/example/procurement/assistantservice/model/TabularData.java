package com.example.procurement.assistantservice.model;

import java.util.List;

public record TabularData(List<String> headers, List<RawRecord> rows) {

    public TabularData {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }
}
