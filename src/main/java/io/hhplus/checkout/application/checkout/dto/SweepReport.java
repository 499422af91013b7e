package io.hhplus.checkout.application.checkout.dto;

/**
 * 만료 스윕 1회 결과
 *
 * @param scanned         조회된 만료 예약 수
 * @param expired         이번 실행이 EXPIRED 로 전이시킨 예약 수
 * @param released        원장 reserved 를 실제로 줄인 예약 수
 * @param sessionsExpired EXPIRED 로 전이된 세션 수
 * @param failures        처리 중 예외가 난 예약 수 (다음 실행에서 다시 시도)
 */
public record SweepReport(
    int scanned,
    int expired,
    int released,
    int sessionsExpired,
    int failures
) {
    public boolean isEmpty() {
        return scanned == 0 && sessionsExpired == 0;
    }
}
