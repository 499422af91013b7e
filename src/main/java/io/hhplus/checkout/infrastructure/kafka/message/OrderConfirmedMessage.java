package io.hhplus.checkout.infrastructure.kafka.message;

import io.hhplus.checkout.domain.order.OrderConfirmedEvent;

import java.time.LocalDateTime;

/**
 * Kafka 주문 확정 메시지
 * - Topic: order-confirmed
 * - Consumer: 외부 알림/메일 서비스
 */
public record OrderConfirmedMessage(
    Long orderId,
    String orderNumber,
    String providerTransactionId,
    String checkoutSessionId,
    Long totalAmount,
    String currency,
    LocalDateTime paidAt
) {
    public static OrderConfirmedMessage from(OrderConfirmedEvent event) {
        return new OrderConfirmedMessage(
            event.getOrderId(),
            event.getOrderNumber(),
            event.getProviderTransactionId(),
            event.getCheckoutSessionId(),
            event.getTotalAmount(),
            event.getCurrency(),
            event.getPaidAt()
        );
    }
}
