package com.example.procurement.assistantservice.model;

/**
 * A validated procurement record. Quantity is strictly positive, so
 * {@code pricePerUnit} is always defined.
 */
public record CleanRecord(
        int rowIndex,
        String commodity,
        String supplier,
        double quantity,
        double spend,
        double pricePerUnit
) {

    public CleanRecord {
        if (!(quantity > 0) || Double.isInfinite(quantity)) {
            throw new IllegalArgumentException("quantity must be a positive finite number, got " + quantity);
        }
        if (Double.isNaN(spend) || Double.isInfinite(spend)) {
            throw new IllegalArgumentException("spend must be finite, got " + spend);
        }
    }

    public static CleanRecord of(int rowIndex, String commodity, String supplier, double quantity, double spend) {
        return new CleanRecord(rowIndex, commodity, supplier, quantity, spend, spend / quantity);
    }
}
