package io.hhplus.checkout.domain.checkout;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.Optional;

public interface CheckoutSessionRepository {

    Optional<CheckoutSession> findBySessionId(String sessionId);

    CheckoutSession save(CheckoutSession session);

    /**
     * from → to 조건부 전이, stockReserved는 false로 내린다.
     * @return 반영된 행 수 (0: 이미 다른 상태)
     */
    int transition(String sessionId, CheckoutSessionStatus from, CheckoutSessionStatus to, LocalDateTime now);

    /**
     * expiresAt < now 인 열린 세션(PENDING, AWAITING_PAYMENT)을 EXPIRED로 일괄 전이
     */
    int expireOpenSessions(LocalDateTime now);

    default CheckoutSession findBySessionIdOrThrow(String sessionId) {
        return findBySessionId(sessionId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.CHECKOUT_SESSION_NOT_FOUND,
                "체크아웃 세션을 찾을 수 없습니다. sessionId: " + sessionId
            ));
    }
}
