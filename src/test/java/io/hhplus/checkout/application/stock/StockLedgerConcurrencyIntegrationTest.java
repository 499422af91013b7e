package io.hhplus.checkout.application.stock;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.config.TestContainersConfig;
import io.hhplus.checkout.domain.stock.StockLedgerEntry;
import io.hhplus.checkout.domain.stock.StockLedgerRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 재고 원장 조건부 UPDATE 동시성 (MySQL)
 */
@Import(TestContainersConfig.class)
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class StockLedgerConcurrencyIntegrationTest {

    @Autowired
    private StockLedgerService stockLedgerService;

    @Autowired
    private StockLedgerRepository stockLedgerRepository;

    @Test
    @DisplayName("재고 10개에 50명이 1개씩 예약 - 정확히 10건 성공, 초과 예약 없음")
    void reserve_동시성() throws InterruptedException {
        // Given
        String productId = "P-" + UUID.randomUUID().toString().substring(0, 8);
        stockLedgerRepository.save(StockLedgerEntry.create(productId, "M", 10));

        int threadCount = 50;
        ExecutorService executorService = Executors.newFixedThreadPool(16);
        CountDownLatch latch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger failCount = new AtomicInteger();

        // When
        for (int i = 0; i < threadCount; i++) {
            executorService.submit(() -> {
                try {
                    stockLedgerService.reserve(productId, "M", 1);
                    successCount.incrementAndGet();
                } catch (BusinessException e) {
                    failCount.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }
        latch.await(30, TimeUnit.SECONDS);
        executorService.shutdown();

        // Then
        assertThat(successCount.get()).isEqualTo(10);
        assertThat(failCount.get()).isEqualTo(40);
        StockLedgerEntry entry = stockLedgerRepository.findByProductIdAndSizeOrThrow(productId, "M");
        assertThat(entry.getStock()).isEqualTo(10);
        assertThat(entry.getReserved()).isEqualTo(10);
        assertThat(entry.getAvailableStock()).isZero();
    }

    @Test
    @DisplayName("예약 → 확정 → 해제 후 원장 수치")
    void reserve_commit_release() {
        // Given
        String productId = "P-" + UUID.randomUUID().toString().substring(0, 8);
        stockLedgerRepository.save(StockLedgerEntry.create(productId, "L", 5));

        // When
        stockLedgerService.reserve(productId, "L", 2);
        stockLedgerService.commit(productId, "L", 1);
        stockLedgerService.release(productId, "L", 1);

        // Then
        StockLedgerEntry entry = stockLedgerRepository.findByProductIdAndSizeOrThrow(productId, "L");
        assertThat(entry.getStock()).isEqualTo(4);
        assertThat(entry.getReserved()).isZero();
    }
}
