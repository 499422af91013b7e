package io.hhplus.checkout.domain.webhook;

/**
 * 웹훅 한 건의 내부 처리 결과
 */
public enum WebhookResult {
    RECEIVED,       // 기록됨, 아직 결론 없음
    PROCESSED,      // claim 획득 후 주문 전이 완료
    DUPLICATE,      // 동일 dedupKey를 다른 전달이 먼저 선점
    IGNORED,        // 대기 상태 보고, 주문 없음, 이미 종료된 주문 등 반영할 것이 없음
    REJECTED,       // 서명/본문/금액 검증 실패
    QUEUED,         // 일시 장애로 재처리 큐에 적재
    MANUAL_REVIEW   // 예약 불일치, 운영자 확인 필요
}
