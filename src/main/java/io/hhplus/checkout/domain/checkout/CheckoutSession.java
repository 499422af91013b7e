package io.hhplus.checkout.domain.checkout;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 체크아웃 세션
 *
 * 상태 전이:
 * PENDING → AWAITING_PAYMENT → {COMPLETED, EXPIRED, CANCELLED}
 * PENDING → CANCELLED (예약 부분 실패 보상)
 *
 * 생성 이후의 전이는 세션을 만든 요청 외의 주체(웹훅, 스위퍼)가 수행하므로
 * CheckoutSessionRepository.transition 조건부 UPDATE로 처리한다.
 */
@Entity
@Table(
    name = "checkout_sessions",
    indexes = {
        @Index(name = "idx_session_status_expires", columnList = "status, expires_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CheckoutSession extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", unique = true, nullable = false, length = 64)
    private String sessionId;

    @Column(name = "user_email", length = 200)
    private String userEmail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CheckoutSessionStatus status;

    @Column(name = "stock_reserved", nullable = false)
    private boolean stockReserved;

    @Column(name = "total_amount", nullable = false)
    private Long totalAmount;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    public static CheckoutSession create(String sessionId, String userEmail, Long totalAmount, LocalDateTime expiresAt) {
        validateSessionId(sessionId);
        validateAmount(totalAmount);
        if (expiresAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "세션 만료 시각은 필수입니다");
        }

        CheckoutSession session = new CheckoutSession();
        session.sessionId = sessionId;
        session.userEmail = userEmail;
        session.totalAmount = totalAmount;
        session.expiresAt = expiresAt;
        session.status = CheckoutSessionStatus.PENDING;
        session.stockReserved = false;
        return session;
    }

    /**
     * 모든 라인의 재고 예약이 끝난 뒤 호출
     */
    public void markAwaitingPayment() {
        if (this.status != CheckoutSessionStatus.PENDING) {
            throw new BusinessException(
                ErrorCode.INVALID_SESSION_STATUS,
                String.format("예약 중인 세션만 결제 대기로 전환할 수 있습니다. 현재 상태: %s", this.status)
            );
        }
        this.status = CheckoutSessionStatus.AWAITING_PAYMENT;
        this.stockReserved = true;
    }

    /**
     * InMemory 저장소용 조건부 전이. from 상태가 아니면 false.
     */
    public boolean transition(CheckoutSessionStatus from, CheckoutSessionStatus to, LocalDateTime now) {
        if (this.status != from) {
            return false;
        }
        this.status = to;
        this.stockReserved = false;
        this.closedAt = now;
        return true;
    }

    public boolean isOpen() {
        return status.isOpen();
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt.isBefore(now);
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "세션 ID는 필수입니다");
        }
    }

    private static void validateAmount(Long totalAmount) {
        if (totalAmount == null || totalAmount <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "세션 금액은 0보다 커야 합니다");
        }
    }
}
