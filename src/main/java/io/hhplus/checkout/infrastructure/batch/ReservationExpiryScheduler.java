package io.hhplus.checkout.infrastructure.batch;

import io.hhplus.checkout.application.checkout.ReservationExpiryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "checkout.sweeper.enabled", havingValue = "true", matchIfMissing = true)
public class ReservationExpiryScheduler {

    private final ReservationExpiryService reservationExpiryService;

    @Scheduled(fixedDelayString = "${checkout.sweeper.interval-ms:60000}")
    public void sweepExpiredReservations() {
        LocalDateTime now = LocalDateTime.now();
        try {
            reservationExpiryService.sweep(now);
        } catch (Exception e) {
            log.error("Error during reservation expiry sweep at {}", now, e);
        }
    }
}
