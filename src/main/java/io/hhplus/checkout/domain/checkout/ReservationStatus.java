package io.hhplus.checkout.domain.checkout;

public enum ReservationStatus {
    ACTIVE,     // 재고 확보, 결제 대기
    CONFIRMED,  // 결제 성공으로 원장 commit 완료
    EXPIRED,    // 스위퍼가 만료 처리 후 해제
    RELEASED    // 결제 실패/쇼핑객 취소/부분 실패 보상으로 해제
}
