package io.hhplus.checkout.domain.order;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문
 *
 * DRAFT → {CONFIRMED, CANCELLED}, 결제 상태는 PENDING → {PAID, FAILED}.
 * 운영 경로의 전이는 OrderRepository.confirmIfDraft / cancelIfDraft 조건부 UPDATE로만 일어나며,
 * 아래 confirm()/cancel()은 같은 규칙을 엔티티 수준에서 표현한다.
 */
@Entity
@Table(
    name = "orders",
    indexes = {
        @Index(name = "idx_order_session", columnList = "checkout_session_id"),
        @Index(name = "idx_order_status_paid", columnList = "status, paid_at")
    }
)
@Getter
@NoArgsConstructor
public class Order extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_number", unique = true, length = 40, nullable = false)
    private String orderNumber;  // 외부 노출용 (e.g., "ORD-20251019-A1B2C3")

    @Column(name = "provider_transaction_id", unique = true, length = 100, nullable = false)
    private String providerTransactionId;  // 결제 제공자에 전달한 거래 ID (merchantTransactionId)

    @Column(name = "checkout_session_id", nullable = false, length = 64)
    private String checkoutSessionId;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    private List<OrderItem> orderItems = new ArrayList<>();

    @Column(name = "total_amount", nullable = false)
    private Long totalAmount;  // minor unit (paise)

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    public static Order createDraft(String orderNumber, String providerTransactionId,
                                    String checkoutSessionId, String currency) {
        validateOrderNumber(orderNumber);
        validateProviderTransactionId(providerTransactionId);
        validateCheckoutSessionId(checkoutSessionId);

        Order order = new Order();
        order.orderNumber = orderNumber;
        order.providerTransactionId = providerTransactionId;
        order.checkoutSessionId = checkoutSessionId;
        order.currency = (currency == null || currency.isBlank()) ? "INR" : currency;
        order.totalAmount = 0L;  // OrderItem 추가 시 누적
        order.status = OrderStatus.DRAFT;
        order.paymentStatus = PaymentStatus.PENDING;
        return order;
    }

    void addOrderItem(OrderItem orderItem) {
        if (this.status != OrderStatus.DRAFT) {
            throw new BusinessException(
                ErrorCode.INVALID_ORDER_STATUS,
                "임시 주문에만 상품을 추가할 수 있습니다. 현재 상태: " + this.status
            );
        }
        this.orderItems.add(orderItem);
        this.totalAmount += orderItem.getSubtotal();
    }

    public void confirm(LocalDateTime now) {
        validateDraft("확정");

        this.status = OrderStatus.CONFIRMED;
        this.paymentStatus = PaymentStatus.PAID;
        this.paidAt = now;
    }

    public void cancel(LocalDateTime now) {
        validateDraft("취소");

        this.status = OrderStatus.CANCELLED;
        this.paymentStatus = PaymentStatus.FAILED;
        this.cancelledAt = now;
    }

    public boolean isDraft() {
        return this.status == OrderStatus.DRAFT;
    }

    public boolean isConfirmed() {
        return this.status == OrderStatus.CONFIRMED;
    }

    public boolean isCancelled() {
        return this.status == OrderStatus.CANCELLED;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateOrderNumber(String orderNumber) {
        if (orderNumber == null || orderNumber.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "주문 번호는 필수입니다");
        }
    }

    private static void validateProviderTransactionId(String providerTransactionId) {
        if (providerTransactionId == null || providerTransactionId.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "결제 거래 ID는 필수입니다");
        }
    }

    private static void validateCheckoutSessionId(String checkoutSessionId) {
        if (checkoutSessionId == null || checkoutSessionId.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "체크아웃 세션 ID는 필수입니다");
        }
    }

    private void validateDraft(String action) {
        if (this.status != OrderStatus.DRAFT) {
            throw new BusinessException(
                ErrorCode.INVALID_ORDER_STATUS,
                String.format("임시 주문만 %s할 수 있습니다. 현재 상태: %s", action, this.status)
            );
        }
    }
}
