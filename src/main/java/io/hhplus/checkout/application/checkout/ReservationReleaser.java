package io.hhplus.checkout.application.checkout;

import io.hhplus.checkout.application.stock.StockLedgerService;
import io.hhplus.checkout.domain.checkout.Reservation;
import io.hhplus.checkout.domain.checkout.ReservationRepository;
import io.hhplus.checkout.domain.checkout.ReservationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 예약 1건 회수 (ACTIVE → RELEASED/EXPIRED + 원장 release)
 *
 * 두 쓰기는 하나의 짧은 트랜잭션으로 묶는다.
 * 원장 release 가 실패하면 예약을 ACTIVE 로 되돌려 다음 회수 시도가 다시 잡을 수 있게 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationReleaser {

    private final ReservationRepository reservationRepository;
    private final StockLedgerService stockLedgerService;

    /**
     * @return false: 다른 주체가 이미 정리한 예약
     * @throws RuntimeException 원장 release 실패 (예약은 ACTIVE 로 복구됨)
     */
    @Transactional
    public boolean releaseIfActive(Reservation reservation, ReservationStatus target, LocalDateTime now) {
        int updated = reservationRepository.transition(
            reservation.getId(), ReservationStatus.ACTIVE, target, now);
        if (updated == 0) {
            return false;
        }

        try {
            stockLedgerService.release(reservation.getProductId(), reservation.getSize(), reservation.getQuantity());
        } catch (RuntimeException e) {
            restoreActive(reservation, target, now, e);
            throw e;
        }
        return true;
    }

    private void restoreActive(Reservation reservation, ReservationStatus target, LocalDateTime now, RuntimeException cause) {
        try {
            reservationRepository.transition(reservation.getId(), target, ReservationStatus.ACTIVE, now);
            log.warn("Stock release failed, reservation restored to ACTIVE: reservationId={}, productId={}, size={}",
                reservation.getId(), reservation.getProductId(), reservation.getSize());
        } catch (RuntimeException restoreError) {
            cause.addSuppressed(restoreError);
        }
    }
}
