package io.hhplus.checkout.application.order;

/**
 * 주문 전이 결과
 */
public enum TransitionResult {
    CONFIRMED,
    CANCELLED,
    ALREADY_TERMINAL  // 다른 전달이 먼저 종료 상태로 만듦 (no-op)
}
