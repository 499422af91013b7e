package io.hhplus.checkout.domain.order;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(
    name = "order_items",
    indexes = {
        @Index(name = "idx_order_item_order", columnList = "order_id")
    }
)
@Getter
@NoArgsConstructor
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false, foreignKey = @ForeignKey(name = "fk_order_item_order"))
    private Order order;

    @Column(name = "product_id", nullable = false, length = 64)
    private String productId;     // 카탈로그는 외부 시스템, ID만 보관

    @Column(nullable = false, length = 16)
    private String size;

    @Column(nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false)
    private Long unitPrice;       // 주문 시점 단가 (스냅샷, minor unit)

    @Column(nullable = false)
    private Long subtotal;        // unitPrice * quantity

    public static OrderItem create(Order order, String productId, String size, Integer quantity, Long unitPrice) {
        validateOrder(order);
        validateProduct(productId, size);
        validateQuantity(quantity);
        validateUnitPrice(unitPrice);

        OrderItem orderItem = new OrderItem();
        orderItem.order = order;
        orderItem.productId = productId;
        orderItem.size = size;
        orderItem.quantity = quantity;
        orderItem.unitPrice = unitPrice;
        orderItem.subtotal = unitPrice * quantity;

        order.addOrderItem(orderItem);
        return orderItem;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateOrder(Order order) {
        if (order == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "주문은 필수입니다");
        }
    }

    private static void validateProduct(String productId, String size) {
        if (productId == null || productId.isBlank() || size == null || size.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "상품 ID와 사이즈는 필수입니다");
        }
    }

    private static void validateQuantity(Integer quantity) {
        if (quantity == null || quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
    }

    private static void validateUnitPrice(Long unitPrice) {
        if (unitPrice == null || unitPrice <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "상품 가격은 0보다 커야 합니다");
        }
    }
}
