package io.hhplus.checkout.domain.order;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 주문 취소(결제 실패) 도메인 이벤트
 */
@Getter
@AllArgsConstructor
public class OrderCancelledEvent {
    private final Long orderId;
    private final String orderNumber;
    private final String providerTransactionId;
    private final String checkoutSessionId;
    private final String reportedState;
    private final LocalDateTime cancelledAt;
}
