package io.hhplus.checkout.infrastructure.metrics;

import io.hhplus.checkout.domain.webhook.WebhookResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 웹훅/재고 예약 메트릭 수집
 *
 * 수집 메트릭:
 * - webhook_total{result}: 웹훅 처리 결과별 카운터
 * - webhook_duration_seconds: 웹훅 처리 시간 (P50, P95, P99)
 * - webhook_ack_timeout_total: ack 타임아웃 후 백그라운드로 넘어간 건수
 * - reservation_total{status}: 체크아웃 예약 성공/실패
 * - stock_errors_total: 재고 부족 에러
 * - reservation_inconsistent_total: 예약 불일치 (운영자 확인 필요)
 * - sweeper_released_total: 스위퍼가 회수한 예약 수
 */
@Component
public class MetricsCollector {

    private final Map<WebhookResult, Counter> webhookCounters = new EnumMap<>(WebhookResult.class);
    private final Timer webhookDurationTimer;
    private final Counter webhookAckTimeoutCounter;

    private final Counter reservationSuccessCounter;
    private final Counter reservationFailureCounter;
    private final Counter stockErrorCounter;
    private final Counter reservationInconsistentCounter;

    private final Counter sweeperReleasedCounter;

    public MetricsCollector(MeterRegistry meterRegistry) {
        for (WebhookResult result : WebhookResult.values()) {
            webhookCounters.put(result, Counter.builder("webhook_total")
                    .tag("result", result.name().toLowerCase(Locale.ROOT))
                    .description("Total number of payment webhooks by result")
                    .register(meterRegistry));
        }

        this.webhookDurationTimer = Timer.builder("webhook_duration_seconds")
                .description("Payment webhook processing duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.webhookAckTimeoutCounter = Counter.builder("webhook_ack_timeout_total")
                .description("Webhooks acknowledged before processing finished")
                .register(meterRegistry);

        // 예약 메트릭
        this.reservationSuccessCounter = Counter.builder("reservation_total")
                .tag("status", "success")
                .description("Total number of successful checkout reservations")
                .register(meterRegistry);

        this.reservationFailureCounter = Counter.builder("reservation_total")
                .tag("status", "failure")
                .description("Total number of failed checkout reservations")
                .register(meterRegistry);

        this.stockErrorCounter = Counter.builder("stock_errors_total")
                .description("Total number of stock shortage errors")
                .register(meterRegistry);

        this.reservationInconsistentCounter = Counter.builder("reservation_inconsistent_total")
                .description("Reservations that could not be committed against the ledger")
                .register(meterRegistry);

        this.sweeperReleasedCounter = Counter.builder("sweeper_released_total")
                .description("Reservations released by the expiry sweeper")
                .register(meterRegistry);
    }

    // ============================================================
    // 웹훅 관련 메트릭
    // ============================================================

    public void recordWebhook(WebhookResult result) {
        webhookCounters.get(result).increment();
    }

    public void recordWebhookDuration(long startTimeMs) {
        long duration = System.currentTimeMillis() - startTimeMs;
        webhookDurationTimer.record(duration, TimeUnit.MILLISECONDS);
    }

    public void recordAckTimeout() {
        webhookAckTimeoutCounter.increment();
    }

    // ============================================================
    // 재고/예약 관련 메트릭
    // ============================================================

    public void recordReservationSuccess() {
        reservationSuccessCounter.increment();
    }

    public void recordReservationFailure() {
        reservationFailureCounter.increment();
    }

    public void recordStockError() {
        stockErrorCounter.increment();
    }

    public void recordReservationInconsistent() {
        reservationInconsistentCounter.increment();
    }

    public void recordSweeperReleased(int count) {
        sweeperReleasedCounter.increment(count);
    }
}
