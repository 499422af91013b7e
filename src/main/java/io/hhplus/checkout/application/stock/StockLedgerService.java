package io.hhplus.checkout.application.stock;

import io.hhplus.checkout.application.stock.dto.StockAvailabilityResponse;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.stock.StockLedgerEntry;
import io.hhplus.checkout.domain.stock.StockLedgerRepository;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * 재고 원장 서비스
 *
 * 모든 변경은 저장소의 단일 조건부 UPDATE 한 번으로 끝난다 (조회 후 쓰기 없음).
 * 조회는 실패 원인을 구분할 때만 사용한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockLedgerService {

    private final StockLedgerRepository stockLedgerRepository;
    private final MetricsCollector metricsCollector;

    /**
     * 가용 재고에서 quantity 만큼 예약
     *
     * @throws BusinessException INSUFFICIENT_STOCK, STOCK_ENTRY_NOT_FOUND, INVALID_QUANTITY
     */
    public void reserve(String productId, String size, int quantity) {
        validateQuantity(quantity);

        int updated = stockLedgerRepository.reserve(productId, size, quantity);
        if (updated == 1) {
            log.debug("Stock reserved: productId={}, size={}, quantity={}", productId, size, quantity);
            return;
        }

        if (stockLedgerRepository.findByProductIdAndSize(productId, size).isEmpty()) {
            throw new BusinessException(
                ErrorCode.STOCK_ENTRY_NOT_FOUND,
                "재고 원장을 찾을 수 없습니다. productId: " + productId + ", size: " + size
            );
        }

        metricsCollector.recordStockError();
        throw new BusinessException(
            ErrorCode.INSUFFICIENT_STOCK,
            String.format("재고가 부족합니다. productId: %s, size: %s, 요청: %d", productId, size, quantity)
        );
    }

    /**
     * 예약분을 실재고에서 차감 (결제 확정)
     *
     * @throws BusinessException RESERVATION_INCONSISTENT 예약 수량이 원장에 없음 (치명적)
     */
    public void commit(String productId, String size, int quantity) {
        validateQuantity(quantity);

        int updated = stockLedgerRepository.commit(productId, size, quantity);
        if (updated == 0) {
            metricsCollector.recordReservationInconsistent();
            log.error("[ALERT] Stock commit failed, reservation missing in ledger: productId={}, size={}, quantity={}",
                productId, size, quantity);
            throw new BusinessException(
                ErrorCode.RESERVATION_INCONSISTENT,
                String.format("예약 수량을 확정할 수 없습니다. productId: %s, size: %s, 수량: %d", productId, size, quantity)
            );
        }
        log.debug("Stock committed: productId={}, size={}, quantity={}", productId, size, quantity);
    }

    /**
     * 예약 해제. 여러 번 호출해도 reserved는 0 아래로 내려가지 않는다.
     *
     * @return 원장이 실제로 변경되었는지 여부
     */
    public boolean release(String productId, String size, int quantity) {
        validateQuantity(quantity);

        int updated = stockLedgerRepository.release(productId, size, quantity);
        if (updated == 0) {
            log.warn("Stock release had no effect (no reservation or unknown entry): productId={}, size={}, quantity={}",
                productId, size, quantity);
            return false;
        }
        log.debug("Stock released: productId={}, size={}, quantity={}", productId, size, quantity);
        return true;
    }

    /**
     * 입고. 원장이 없으면 생성한다.
     * 동시에 처음 생성하는 경우 UNIQUE 위반이 나면 재시도하여 UPDATE 경로로 합류한다.
     */
    @Retryable(
        retryFor = DataIntegrityViolationException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 50)
    )
    public StockAvailabilityResponse restock(String productId, String size, int quantity) {
        validateQuantity(quantity);

        int updated = stockLedgerRepository.addStock(productId, size, quantity);
        if (updated == 0) {
            stockLedgerRepository.save(StockLedgerEntry.create(productId, size, quantity));
            log.info("Stock entry created: productId={}, size={}, stock={}", productId, size, quantity);
        } else {
            log.info("Stock added: productId={}, size={}, quantity={}", productId, size, quantity);
        }
        return availability(productId, size);
    }

    public StockAvailabilityResponse availability(String productId, String size) {
        return StockAvailabilityResponse.from(
            stockLedgerRepository.findByProductIdAndSizeOrThrow(productId, size)
        );
    }

    private void validateQuantity(int quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY, "수량은 1 이상이어야 합니다. 요청: " + quantity);
        }
    }
}
