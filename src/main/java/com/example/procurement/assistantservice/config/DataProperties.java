package com.example.procurement.assistantservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Where the spend records come from and which columns carry the required fields.
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.data")
public class DataProperties {

    /** Filesystem path or {@code classpath:} location of a .csv or .json file. */
    private String path = "classpath:data/spend_data.csv";

    private Columns columns = new Columns();

    @Data
    public static class Columns {
        private String commodity = "Commodity";
        private String supplier = "Top Supplier";
        private String quantity = "Quantity (KG)";
        private String spend = "Spend (USD)";

        public List<String> required() {
            return List.of(commodity, supplier, quantity, spend);
        }
    }
}
