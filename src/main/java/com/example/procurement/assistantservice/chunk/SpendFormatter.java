package com.example.procurement.assistantservice.chunk;

import com.example.procurement.assistantservice.config.ChunkProperties;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Currency and quantity formatting shared by the chunk views. Always uses
 * {@link Locale#US} separators so the chunk text does not depend on the JVM locale.
 */
public class SpendFormatter {

    private final ChunkProperties units;

    public SpendFormatter(ChunkProperties units) {
        this.units = units;
    }

    /** {@code 1234.5 -> "$1,234.50"} */
    public String money(double amount) {
        return units.getCurrencySymbol() + String.format(Locale.US, "%,.2f", amount);
    }

    /** {@code 0.5 -> "$0.50"} */
    public String unitPrice(double price) {
        return units.getCurrencySymbol() + String.format(Locale.US, "%.2f", price);
    }

    /** {@code 1000.0 -> "1000"}, {@code 12.50 -> "12.5"} */
    public String quantity(double quantity) {
        return BigDecimal.valueOf(quantity).stripTrailingZeros().toPlainString();
    }

    public ChunkProperties units() {
        return units;
    }
}
