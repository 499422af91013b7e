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
 * 체크아웃 라인 단위 재고 예약
 *
 * ACTIVE에서 벗어나는 전이는 한 번만 성공한다 (웹훅 commit, 웹훅 release, 쇼핑객 release, 스위퍼 중 하나).
 * 전이에 성공한 주체만 재고 원장을 건드린다.
 */
@Entity
@Table(
    name = "reservations",
    indexes = {
        @Index(name = "idx_reservation_session", columnList = "checkout_session_id"),
        @Index(name = "idx_reservation_status_expires", columnList = "status, expires_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Reservation extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "checkout_session_id", nullable = false, length = 64)
    private String checkoutSessionId;

    @Column(name = "product_id", nullable = false, length = 64)
    private String productId;

    @Column(nullable = false, length = 16)
    private String size;

    @Column(nullable = false)
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    public static Reservation create(String checkoutSessionId, String productId, String size,
                                     int quantity, LocalDateTime expiresAt) {
        if (checkoutSessionId == null || checkoutSessionId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "세션 ID는 필수입니다");
        }
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }

        Reservation reservation = new Reservation();
        reservation.checkoutSessionId = checkoutSessionId;
        reservation.productId = productId;
        reservation.size = size;
        reservation.quantity = quantity;
        reservation.expiresAt = expiresAt;
        reservation.status = ReservationStatus.ACTIVE;
        return reservation;
    }

    /**
     * InMemory 저장소용 조건부 전이
     */
    public boolean transition(ReservationStatus from, ReservationStatus to, LocalDateTime now) {
        if (this.status != from) {
            return false;
        }
        this.status = to;
        this.resolvedAt = now;
        return true;
    }

    public boolean isActive() {
        return status == ReservationStatus.ACTIVE;
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt.isBefore(now);
    }
}
