package io.hhplus.checkout.application.checkout;

import io.hhplus.checkout.application.checkout.dto.SweepReport;
import io.hhplus.checkout.config.CheckoutProperties;
import io.hhplus.checkout.domain.checkout.CheckoutSessionRepository;
import io.hhplus.checkout.domain.checkout.Reservation;
import io.hhplus.checkout.domain.checkout.ReservationRepository;
import io.hhplus.checkout.domain.checkout.ReservationStatus;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 만료 예약 회수
 *
 * ACTIVE → EXPIRED 전이에 성공한 실행만 원장 release 를 호출한다.
 * release 가 실패한 예약은 ACTIVE 로 돌아가 다음 주기에 다시 회수된다.
 * 여러 인스턴스가 동시에 돌거나 같은 시점에 결제 확정이 일어나도 재고는 한 번만 돌아간다.
 * DRAFT 주문은 건드리지 않는다. 늦게 도착한 SUCCESS 는 예약 불일치로 운영자 확인 대상이 된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationExpiryService {

    private final ReservationRepository reservationRepository;
    private final CheckoutSessionRepository checkoutSessionRepository;
    private final ReservationReleaser reservationReleaser;
    private final CheckoutProperties checkoutProperties;
    private final MetricsCollector metricsCollector;

    public SweepReport sweep(LocalDateTime now) {
        List<Reservation> candidates = reservationRepository.findExpiredActive(
            now, checkoutProperties.getSweeper().getBatchSize());

        int expired = 0;
        int released = 0;
        int failures = 0;

        for (Reservation reservation : candidates) {
            try {
                if (!reservationReleaser.releaseIfActive(reservation, ReservationStatus.EXPIRED, now)) {
                    continue;  // 다른 주체가 먼저 정리
                }
                expired++;
                released++;
            } catch (RuntimeException e) {
                failures++;
                log.error("Failed to expire reservation: reservationId={}, sessionId={}",
                    reservation.getId(), reservation.getCheckoutSessionId(), e);
            }
        }

        int sessionsExpired = checkoutSessionRepository.expireOpenSessions(now);

        metricsCollector.recordSweeperReleased(released);
        SweepReport report = new SweepReport(candidates.size(), expired, released, sessionsExpired, failures);
        if (!report.isEmpty()) {
            log.info("Reservation sweep finished: {}", report);
        }
        return report;
    }
}
