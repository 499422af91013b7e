package io.hhplus.checkout.application.checkout.dto;

import java.time.LocalDateTime;

/**
 * 스토어프론트가 결제 제공자 결제를 시작할 때 넘기는 값
 */
public record StartCheckoutResponse(
    String sessionId,
    Long orderId,
    String orderNumber,
    String providerTransactionId,
    Long totalAmount,
    String currency,
    LocalDateTime expiresAt
) {}
