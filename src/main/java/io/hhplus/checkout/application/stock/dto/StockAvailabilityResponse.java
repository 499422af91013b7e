package io.hhplus.checkout.application.stock.dto;

import io.hhplus.checkout.domain.stock.StockLedgerEntry;

public record StockAvailabilityResponse(
    String productId,
    String size,
    int stock,
    int reserved,
    int availableStock
) {
    public static StockAvailabilityResponse from(StockLedgerEntry entry) {
        return new StockAvailabilityResponse(
            entry.getProductId(),
            entry.getSize(),
            entry.getStock(),
            entry.getReserved(),
            entry.getAvailableStock()
        );
    }
}
