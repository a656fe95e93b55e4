package com.example.procurement.assistantservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "app.chunk")
public class ChunkProperties {

    private String currencySymbol = "$";
    private String currencyCode = "USD";
    private String unitName = "kilogram";
    private String unitPlural = "kilograms";
    private String unitAbbreviation = "kg";
}
