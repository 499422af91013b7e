package io.hhplus.checkout.application.stock;

import io.hhplus.checkout.application.stock.dto.StockAvailabilityResponse;
import io.hhplus.checkout.application.stock.dto.StockHealthResponse;
import io.hhplus.checkout.config.CheckoutProperties;
import io.hhplus.checkout.domain.stock.StockLedgerEntry;
import io.hhplus.checkout.infrastructure.persistence.stock.InMemoryStockLedgerRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StockHealthServiceTest {

    @Test
    @DisplayName("재고 부족, 예약 정체 항목을 구분해 보고한다")
    void report() {
        // Given
        InMemoryStockLedgerRepository repository = new InMemoryStockLedgerRepository();
        repository.save(StockLedgerEntry.create("P001", "M", 100));
        repository.save(StockLedgerEntry.create("P002", "S", 3));
        repository.save(StockLedgerEntry.create("P003", "L", 10));
        repository.reserve("P003", "L", 8);

        CheckoutProperties properties = new CheckoutProperties();
        properties.getStock().setLowStockThreshold(5);
        properties.getStock().setStuckReservationRatio(0.5);

        // When
        StockHealthResponse report = new StockHealthService(repository, properties).report();

        // Then
        assertThat(report.totalEntries()).isEqualTo(3);
        assertThat(report.totalStock()).isEqualTo(113);
        assertThat(report.totalReserved()).isEqualTo(8);
        assertThat(report.totalAvailable()).isEqualTo(105);
        assertThat(report.lowStock()).extracting(StockAvailabilityResponse::productId)
            .containsExactly("P002", "P003");
        assertThat(report.stuckReservations()).extracting(StockAvailabilityResponse::productId)
            .containsExactly("P003");
    }
}
