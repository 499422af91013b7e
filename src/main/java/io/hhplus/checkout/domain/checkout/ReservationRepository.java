package io.hhplus.checkout.domain.checkout;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface ReservationRepository {

    Reservation save(Reservation reservation);

    Optional<Reservation> findById(Long id);

    List<Reservation> findByCheckoutSessionId(String checkoutSessionId);

    /**
     * ACTIVE 이면서 expiresAt < now 인 예약 (오래된 순, 최대 limit개)
     */
    List<Reservation> findExpiredActive(LocalDateTime now, int limit);

    /**
     * 단일 행 조건부 전이
     * @return 1: 전이 성공, 0: 이미 다른 주체가 전이함
     */
    int transition(Long id, ReservationStatus from, ReservationStatus to, LocalDateTime now);

    long countByStatus(ReservationStatus status);
}
