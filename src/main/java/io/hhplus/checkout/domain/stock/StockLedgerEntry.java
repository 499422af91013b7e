package io.hhplus.checkout.domain.stock;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 상품+사이즈 단위 재고 원장
 *
 * - stock: 실물 재고 (commit 시에만 감소)
 * - reserved: 결제 대기 중인 예약 수량
 * - availableStock = stock - reserved, 항상 0 이상
 *
 * 운영 경로의 변경은 모두 StockLedgerRepository의 조건부 UPDATE(reserve/commit/release)로만 일어난다.
 * 아래 도메인 메서드는 같은 규칙을 엔티티 수준에서 표현하며 InMemory 저장소가 사용한다.
 */
@Entity
@Table(
    name = "stock_ledger",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_stock_product_size", columnNames = {"product_id", "size"})
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StockLedgerEntry extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "product_id", nullable = false, length = 64)
    private String productId;

    @Column(nullable = false, length = 16)
    private String size;

    @Column(nullable = false)
    private int stock;

    @Column(nullable = false)
    private int reserved;

    public static StockLedgerEntry create(String productId, String size, int stock) {
        validateKey(productId, size);
        if (stock < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "재고는 0 이상이어야 합니다");
        }

        StockLedgerEntry entry = new StockLedgerEntry();
        entry.productId = productId;
        entry.size = size;
        entry.stock = stock;
        entry.reserved = 0;
        return entry;
    }

    public int getAvailableStock() {
        return stock - reserved;
    }

    public boolean canReserve(int quantity) {
        return quantity > 0 && getAvailableStock() >= quantity;
    }

    public boolean canCommit(int quantity) {
        return quantity > 0 && reserved >= quantity && stock >= quantity;
    }

    public void reserve(int quantity) {
        if (!canReserve(quantity)) {
            throw new BusinessException(
                ErrorCode.INSUFFICIENT_STOCK,
                String.format("재고 부족: productId=%s, size=%s, 가용 %d, 요청 %d",
                    productId, size, getAvailableStock(), quantity)
            );
        }
        this.reserved += quantity;
    }

    public void commit(int quantity) {
        if (!canCommit(quantity)) {
            throw new BusinessException(
                ErrorCode.RESERVATION_INCONSISTENT,
                String.format("예약 확정 불가: productId=%s, size=%s, stock=%d, reserved=%d, 요청 %d",
                    productId, size, stock, reserved, quantity)
            );
        }
        this.stock -= quantity;
        this.reserved -= quantity;
    }

    /**
     * 예약 해제. 0 아래로 내려가지 않으며 실제로 줄어든 경우에만 true.
     */
    public boolean release(int quantity) {
        if (quantity <= 0 || reserved == 0) {
            return false;
        }
        this.reserved = Math.max(this.reserved - quantity, 0);
        return true;
    }

    public void restock(int quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
        this.stock += quantity;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateKey(String productId, String size) {
        if (productId == null || productId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "상품 ID는 필수입니다");
        }
        if (size == null || size.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "사이즈는 필수입니다");
        }
    }
}
