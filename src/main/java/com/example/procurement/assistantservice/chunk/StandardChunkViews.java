package com.example.procurement.assistantservice.chunk;

import com.example.procurement.assistantservice.config.ChunkProperties;

import java.util.List;

/**
 * The default three perspectives: a full description, a supplier-centric sentence
 * and a cost-centric sentence.
 */
public final class StandardChunkViews {

    private StandardChunkViews() {
    }

    public static List<ChunkView> defaults(SpendFormatter f) {
        return List.of(primary(f), supplierCentric(f), costCentric(f));
    }

    public static ChunkView primary(SpendFormatter f) {
        ChunkProperties u = f.units();
        return ChunkView.of("primary", r -> "Commodity: " + r.commodity() + ". "
                + "Top Supplier: " + r.supplier() + ". "
                + "Quantity Purchased: " + f.quantity(r.quantity()) + " " + u.getUnitPlural() + ". "
                + "Total Spend: " + f.money(r.spend()) + " " + u.getCurrencyCode() + ". "
                + "Price per " + u.getUnitName() + ": " + f.unitPrice(r.pricePerUnit()) + ".");
    }

    public static ChunkView supplierCentric(SpendFormatter f) {
        ChunkProperties u = f.units();
        return ChunkView.of("supplier", r -> r.supplier() + " supplies " + r.commodity() + ", "
                + "with " + f.quantity(r.quantity()) + " " + u.getUnitAbbreviation()
                + " purchased for " + f.money(r.spend()) + ".");
    }

    public static ChunkView costCentric(SpendFormatter f) {
        ChunkProperties u = f.units();
        return ChunkView.of("cost", r -> "The spend on " + r.commodity() + " is " + f.money(r.spend()) + ", "
                + "sourced from " + r.supplier() + " at " + f.unitPrice(r.pricePerUnit())
                + " per " + u.getUnitAbbreviation() + ".");
    }
}
