package io.hhplus.checkout.domain.checkout;

import java.util.List;

public enum CheckoutSessionStatus {
    PENDING,           // 예약 진행 중
    AWAITING_PAYMENT,  // 재고 예약 완료, 결제 대기
    COMPLETED,         // 결제 확정
    EXPIRED,           // TTL 초과로 스위퍼가 정리
    CANCELLED;         // 쇼핑객 해제 또는 결제 실패

    public static List<CheckoutSessionStatus> openStatuses() {
        return List.of(PENDING, AWAITING_PAYMENT);
    }

    public boolean isOpen() {
        return this == PENDING || this == AWAITING_PAYMENT;
    }
}
