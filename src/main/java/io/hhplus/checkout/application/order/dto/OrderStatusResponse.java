package io.hhplus.checkout.application.order.dto;

import io.hhplus.checkout.domain.order.Order;

import java.time.LocalDateTime;

public record OrderStatusResponse(
    Long orderId,
    String orderNumber,
    String status,
    String paymentStatus,
    Long totalAmount,
    String currency,
    LocalDateTime paidAt,
    LocalDateTime cancelledAt
) {
    public static OrderStatusResponse from(Order order) {
        return new OrderStatusResponse(
            order.getId(),
            order.getOrderNumber(),
            order.getStatus().name(),
            order.getPaymentStatus().name(),
            order.getTotalAmount(),
            order.getCurrency(),
            order.getPaidAt(),
            order.getCancelledAt()
        );
    }
}
