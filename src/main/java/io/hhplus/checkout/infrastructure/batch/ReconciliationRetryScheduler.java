package io.hhplus.checkout.infrastructure.batch;

import io.hhplus.checkout.application.reconciliation.ReconciliationService;
import io.hhplus.checkout.application.usecase.webhook.ProcessWebhookUseCase;
import io.hhplus.checkout.application.webhook.WebhookOutcome;
import io.hhplus.checkout.domain.reconciliation.ReconciliationTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 일시 장애로 처리하지 못한 웹훅을 저장된 원문으로 다시 처리한다 (1분, 2분, 4분 백오프).
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "checkout.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationRetryScheduler {

    private final ReconciliationService reconciliationService;
    private final ProcessWebhookUseCase processWebhookUseCase;

    @Value("${checkout.reconciliation.batch-size:50}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${checkout.reconciliation.interval-ms:30000}")
    public void retryDueTasks() {
        try {
            retryDueTasks(LocalDateTime.now());
        } catch (Exception e) {
            log.error("Error during reconciliation retry run", e);
        }
    }

    public int retryDueTasks(LocalDateTime now) {
        List<ReconciliationTask> tasks = reconciliationService.findDueRetries(now, batchSize);
        int succeeded = 0;

        for (ReconciliationTask task : tasks) {
            ReconciliationTask running = reconciliationService.startRetry(task);
            try {
                WebhookOutcome outcome = processWebhookUseCase.reprocess(running.getRawWebhookId());
                if (outcome.needsRetry()) {
                    reconciliationService.markRetryFailed(running, outcome.message());
                } else {
                    reconciliationService.markRetrySucceeded(running);
                    succeeded++;
                }
            } catch (Exception e) {
                reconciliationService.markRetryFailed(running, e.getMessage());
            }
        }

        if (!tasks.isEmpty()) {
            log.info("Reconciliation retry run finished: due={}, succeeded={}", tasks.size(), succeeded);
        }
        return succeeded;
    }
}
