package io.hhplus.checkout.application.stock;

import io.hhplus.checkout.application.stock.dto.StockAvailabilityResponse;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.stock.StockLedgerEntry;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import io.hhplus.checkout.infrastructure.persistence.stock.InMemoryStockLedgerRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class StockLedgerServiceTest {

    private InMemoryStockLedgerRepository stockLedgerRepository;
    private SimpleMeterRegistry meterRegistry;
    private StockLedgerService stockLedgerService;

    @BeforeEach
    void setUp() {
        stockLedgerRepository = new InMemoryStockLedgerRepository();
        meterRegistry = new SimpleMeterRegistry();
        stockLedgerService = new StockLedgerService(stockLedgerRepository, new MetricsCollector(meterRegistry));
        stockLedgerRepository.save(StockLedgerEntry.create("P001", "M", 10));
    }

    @Test
    @DisplayName("예약 → 확정: (10,0) → (10,1) → (9,0)")
    void reserve_commit_성공() {
        // When
        stockLedgerService.reserve("P001", "M", 1);
        StockAvailabilityResponse reserved = stockLedgerService.availability("P001", "M");
        stockLedgerService.commit("P001", "M", 1);
        StockAvailabilityResponse committed = stockLedgerService.availability("P001", "M");

        // Then
        assertThat(reserved.stock()).isEqualTo(10);
        assertThat(reserved.reserved()).isEqualTo(1);
        assertThat(reserved.availableStock()).isEqualTo(9);
        assertThat(committed.stock()).isEqualTo(9);
        assertThat(committed.reserved()).isZero();
    }

    @Test
    @DisplayName("가용 재고 부족 - INSUFFICIENT_STOCK, 원장 변화 없음")
    void reserve_재고부족() {
        assertThatThrownBy(() -> stockLedgerService.reserve("P001", "M", 11))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INSUFFICIENT_STOCK);

        assertThat(stockLedgerService.availability("P001", "M").reserved()).isZero();
        assertThat(meterRegistry.get("stock_errors_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("원장이 없으면 STOCK_ENTRY_NOT_FOUND")
    void reserve_원장없음() {
        assertThatThrownBy(() -> stockLedgerService.reserve("P999", "M", 1))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.STOCK_ENTRY_NOT_FOUND);
    }

    @Test
    @DisplayName("수량 0 이하는 INVALID_QUANTITY")
    void reserve_수량오류() {
        assertThatThrownBy(() -> stockLedgerService.reserve("P001", "M", 0))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_QUANTITY);
    }

    @Test
    @DisplayName("예약 없이 확정하면 RESERVATION_INCONSISTENT, 메트릭 증가")
    void commit_예약없음() {
        assertThatThrownBy(() -> stockLedgerService.commit("P001", "M", 1))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.RESERVATION_INCONSISTENT);

        assertThat(stockLedgerService.availability("P001", "M").stock()).isEqualTo(10);
        assertThat(meterRegistry.get("reservation_inconsistent_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("release 를 여러 번 불러도 reserved 는 0 아래로 내려가지 않는다")
    void release_멱등() {
        // Given
        stockLedgerService.reserve("P001", "M", 1);

        // When
        boolean first = stockLedgerService.release("P001", "M", 1);
        boolean second = stockLedgerService.release("P001", "M", 1);

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(stockLedgerService.availability("P001", "M").reserved()).isZero();
    }

    @Test
    @DisplayName("입고 - 기존 원장에 더하거나 새로 만든다")
    void restock() {
        // When
        StockAvailabilityResponse added = stockLedgerService.restock("P001", "M", 5);
        StockAvailabilityResponse created = stockLedgerService.restock("P002", "L", 3);

        // Then
        assertThat(added.stock()).isEqualTo(15);
        assertThat(created.stock()).isEqualTo(3);
        assertThat(created.reserved()).isZero();
    }

    @Test
    @DisplayName("동시 예약 20건, 재고 10 - 정확히 10건만 성공")
    void reserve_동시성() throws InterruptedException {
        // Given
        int threadCount = 20;
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger failCount = new AtomicInteger();

        // When
        for (int i = 0; i < threadCount; i++) {
            executorService.submit(() -> {
                try {
                    stockLedgerService.reserve("P001", "M", 1);
                    successCount.incrementAndGet();
                } catch (BusinessException e) {
                    failCount.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }
        latch.await(10, TimeUnit.SECONDS);
        executorService.shutdown();

        // Then
        assertThat(successCount.get()).isEqualTo(10);
        assertThat(failCount.get()).isEqualTo(10);
        StockAvailabilityResponse after = stockLedgerService.availability("P001", "M");
        assertThat(after.reserved()).isEqualTo(10);
        assertThat(after.availableStock()).isZero();
    }
}
