package io.hhplus.checkout.infrastructure.kafka.message;

import io.hhplus.checkout.domain.order.OrderCancelledEvent;

import java.time.LocalDateTime;

/**
 * Kafka 주문 취소 메시지
 * - Topic: order-cancelled
 */
public record OrderCancelledMessage(
    Long orderId,
    String orderNumber,
    String providerTransactionId,
    String checkoutSessionId,
    String reportedState,
    LocalDateTime cancelledAt
) {
    public static OrderCancelledMessage from(OrderCancelledEvent event) {
        return new OrderCancelledMessage(
            event.getOrderId(),
            event.getOrderNumber(),
            event.getProviderTransactionId(),
            event.getCheckoutSessionId(),
            event.getReportedState(),
            event.getCancelledAt()
        );
    }
}
