package io.hhplus.checkout.application.facade;

import io.hhplus.checkout.application.usecase.webhook.ProcessWebhookUseCase;
import io.hhplus.checkout.application.webhook.WebhookAck;
import io.hhplus.checkout.application.webhook.WebhookCommand;
import io.hhplus.checkout.application.webhook.WebhookOutcome;
import io.hhplus.checkout.application.webhook.WebhookStoreService;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.config.PaymentWebhookProperties;
import io.hhplus.checkout.domain.webhook.RawWebhook;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 웹훅 수신 Facade
 *
 * - 모르는 제공자: UNKNOWN_PROVIDER (400)
 * - 서명 헤더 없음: 기록 후 MISSING_SIGNATURE (401)
 * - 그 외: 전용 Executor 에서 처리하고 ack 타임아웃까지만 기다린다.
 *   시간이 지나면 처리는 계속되고 제공자에게는 수신 확인을 보낸다.
 */
@Slf4j
@Component
public class WebhookIntakeFacade {

    private final ProcessWebhookUseCase processWebhookUseCase;
    private final WebhookStoreService webhookStoreService;
    private final PaymentWebhookProperties properties;
    private final MetricsCollector metricsCollector;
    private final TaskExecutor webhookExecutor;

    public WebhookIntakeFacade(ProcessWebhookUseCase processWebhookUseCase,
                               WebhookStoreService webhookStoreService,
                               PaymentWebhookProperties properties,
                               MetricsCollector metricsCollector,
                               @Qualifier("webhookExecutor") TaskExecutor webhookExecutor) {
        this.processWebhookUseCase = processWebhookUseCase;
        this.webhookStoreService = webhookStoreService;
        this.properties = properties;
        this.metricsCollector = metricsCollector;
        this.webhookExecutor = webhookExecutor;
    }

    public WebhookAck receive(WebhookCommand command) {
        if (properties.findProvider(command.provider()).isEmpty()) {
            log.warn("Webhook from unknown provider: provider={}, correlationId={}",
                command.provider(), command.correlationId());
            throw new BusinessException(ErrorCode.UNKNOWN_PROVIDER, "등록되지 않은 결제 제공자입니다: " + command.provider());
        }

        if (!command.hasSignature()) {
            RawWebhook rawWebhook = webhookStoreService.record(command);
            rawWebhook.reject(ErrorCode.MISSING_SIGNATURE);
            webhookStoreService.save(rawWebhook);
            log.warn("Webhook without signature recorded: rawWebhookId={}, provider={}, correlationId={}",
                rawWebhook.getId(), command.provider(), command.correlationId());
            throw new BusinessException(ErrorCode.MISSING_SIGNATURE);
        }

        CompletableFuture<WebhookOutcome> future =
            CompletableFuture.supplyAsync(() -> processWebhookUseCase.execute(command), webhookExecutor);

        try {
            WebhookOutcome outcome = future.get(properties.getAckTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return toAck(outcome);
        } catch (TimeoutException e) {
            metricsCollector.recordAckTimeout();
            log.warn("Webhook ack timeout, processing continues: provider={}, correlationId={}, timeout={}",
                command.provider(), command.correlationId(), properties.getAckTimeout());
            return WebhookAck.accepted("수신 완료, 처리 중입니다");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Webhook ack wait interrupted: correlationId={}", command.correlationId());
            return WebhookAck.accepted("수신 완료, 처리 중입니다");
        } catch (ExecutionException e) {
            log.error("Webhook processing failed before recording outcome: provider={}, correlationId={}",
                command.provider(), command.correlationId(), e.getCause());
            return WebhookAck.retryLater("일시적인 오류로 처리하지 못했습니다");
        }
    }

    private WebhookAck toAck(WebhookOutcome outcome) {
        return switch (outcome.result()) {
            case PROCESSED -> WebhookAck.ok("처리 완료: " + outcome.message());
            case DUPLICATE -> WebhookAck.ok("이미 처리된 웹훅입니다");
            case IGNORED -> WebhookAck.ok("수신 완료: " + outcome.message());
            case REJECTED -> WebhookAck.rejected(outcome.message());
            case QUEUED -> WebhookAck.accepted("수신 완료, 재처리 예정입니다");
            case MANUAL_REVIEW -> WebhookAck.ok("수신 완료, 확인이 필요한 건입니다");
            case RECEIVED -> WebhookAck.accepted("수신 완료");
        };
    }
}
