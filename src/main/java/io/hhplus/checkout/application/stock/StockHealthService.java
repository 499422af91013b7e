package io.hhplus.checkout.application.stock;

import io.hhplus.checkout.application.stock.dto.StockAvailabilityResponse;
import io.hhplus.checkout.application.stock.dto.StockHealthResponse;
import io.hhplus.checkout.config.CheckoutProperties;
import io.hhplus.checkout.domain.stock.StockLedgerEntry;
import io.hhplus.checkout.domain.stock.StockLedgerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

@Service
@RequiredArgsConstructor
public class StockHealthService {

    private final StockLedgerRepository stockLedgerRepository;
    private final CheckoutProperties checkoutProperties;

    @Transactional(readOnly = true)
    public StockHealthResponse report() {
        int threshold = checkoutProperties.getStock().getLowStockThreshold();
        double stuckRatio = checkoutProperties.getStock().getStuckReservationRatio();

        List<StockLedgerEntry> entries = stockLedgerRepository.findAll().stream()
                .sorted(Comparator.comparing(StockLedgerEntry::getProductId)
                        .thenComparing(StockLedgerEntry::getSize))
                .toList();

        long totalStock = entries.stream().mapToLong(StockLedgerEntry::getStock).sum();
        long totalReserved = entries.stream().mapToLong(StockLedgerEntry::getReserved).sum();

        List<StockAvailabilityResponse> lowStock = entries.stream()
                .filter(entry -> entry.getAvailableStock() < threshold)
                .map(StockAvailabilityResponse::from)
                .toList();

        List<StockAvailabilityResponse> stuck = entries.stream()
                .filter(entry -> entry.getReserved() > 0 && entry.getReserved() > entry.getStock() * stuckRatio)
                .map(StockAvailabilityResponse::from)
                .toList();

        return new StockHealthResponse(
                entries.size(),
                totalStock,
                totalReserved,
                totalStock - totalReserved,
                threshold,
                lowStock,
                stuck
        );
    }
}
