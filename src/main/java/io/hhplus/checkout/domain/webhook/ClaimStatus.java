package io.hhplus.checkout.domain.webhook;

public enum ClaimStatus {
    PROCESSING,     // 선점자가 처리 중
    COMPLETED,      // 처리 완료, 결과 캐시
    FAILED,         // 일시 장애, 재선점 가능
    MANUAL_REVIEW   // 예약 불일치, 자동 재시도 금지
}
