package io.hhplus.checkout.domain.stock;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;

import java.util.List;
import java.util.Optional;

/**
 * 재고 원장 저장소
 *
 * reserve/commit/release/addStock은 단일 행 조건부 UPDATE이며 반영된 행 수(0 또는 1)를 반환한다.
 */
public interface StockLedgerRepository {

    Optional<StockLedgerEntry> findByProductIdAndSize(String productId, String size);

    List<StockLedgerEntry> findAll();

    StockLedgerEntry save(StockLedgerEntry entry);

    /** reserved += quantity WHERE stock - reserved >= quantity */
    int reserve(String productId, String size, int quantity);

    /** stock -= quantity, reserved -= quantity WHERE reserved >= quantity AND stock >= quantity */
    int commit(String productId, String size, int quantity);

    /** reserved = max(reserved - quantity, 0) WHERE reserved > 0 */
    int release(String productId, String size, int quantity);

    /** stock += quantity */
    int addStock(String productId, String size, int quantity);

    default StockLedgerEntry findByProductIdAndSizeOrThrow(String productId, String size) {
        return findByProductIdAndSize(productId, size)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.STOCK_ENTRY_NOT_FOUND,
                "재고 원장을 찾을 수 없습니다. productId: " + productId + ", size: " + size
            ));
    }
}
