package io.hhplus.checkout.domain.order;

/**
 * 주문 상태
 */
public enum OrderStatus {
    /**
     * 임시 주문 (재고 예약 완료, 결제 결과 대기)
     */
    DRAFT,

    /**
     * 확정 (결제 성공 웹훅으로 재고 commit 완료)
     */
    CONFIRMED,

    /**
     * 취소 (결제 실패 웹훅으로 재고 release 완료)
     */
    CANCELLED
}
