package io.hhplus.checkout.application.usecase.webhook;

import io.hhplus.checkout.application.order.OrderTransitionService;
import io.hhplus.checkout.application.order.TransitionResult;
import io.hhplus.checkout.application.reconciliation.ReconciliationService;
import io.hhplus.checkout.application.usecase.UseCase;
import io.hhplus.checkout.application.webhook.AmountGuard;
import io.hhplus.checkout.application.webhook.ClaimResult;
import io.hhplus.checkout.application.webhook.ParsedWebhook;
import io.hhplus.checkout.application.webhook.PaymentSignatureVerifier;
import io.hhplus.checkout.application.webhook.WebhookCommand;
import io.hhplus.checkout.application.webhook.WebhookOutcome;
import io.hhplus.checkout.application.webhook.WebhookPayloadParser;
import io.hhplus.checkout.application.webhook.WebhookStoreService;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.config.PaymentWebhookProperties;
import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderRepository;
import io.hhplus.checkout.domain.webhook.PaymentState;
import io.hhplus.checkout.domain.webhook.RawWebhook;
import io.hhplus.checkout.domain.webhook.WebhookResult;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * 결제 웹훅 처리 UseCase
 * <p>
 * 처리 순서:
 * 1. 원문 기록 (서명 검증 전, 항상)
 * 2. 서명 검증 실패 → REJECTED (claim 없음)
 * 3. 본문 해석, PENDING 류 상태 → IGNORED
 * 4. 거래 ID로 주문 조회, 없으면 IGNORED
 * 5. 금액 검증 실패 → REJECTED (상태 변경 없음)
 * 6. claim 시도, 지면 DUPLICATE (선점자의 결과 반환)
 * 7. 주문 확정/취소
 *    - 예약 불일치 → claim MANUAL_REVIEW, 운영자 작업 생성
 *    - 저장소 장애/예상 못한 오류 → claim FAILED, 재처리 작업 생성 → QUEUED
 * <p>
 * 전체를 하나의 트랜잭션으로 묶지 않는다. 확정/취소 단계만 짧은 트랜잭션이다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class ProcessWebhookUseCase {

    private final WebhookStoreService webhookStoreService;
    private final PaymentSignatureVerifier signatureVerifier;
    private final WebhookPayloadParser payloadParser;
    private final AmountGuard amountGuard;
    private final OrderRepository orderRepository;
    private final OrderTransitionService orderTransitionService;
    private final ReconciliationService reconciliationService;
    private final PaymentWebhookProperties properties;
    private final MetricsCollector metricsCollector;

    public WebhookOutcome execute(WebhookCommand command) {
        long startTime = System.currentTimeMillis();

        RawWebhook rawWebhook = webhookStoreService.record(command);
        WebhookOutcome outcome = process(rawWebhook, true);

        metricsCollector.recordWebhook(outcome.result());
        metricsCollector.recordWebhookDuration(startTime);
        log.info("Webhook processed: correlationId={}, provider={}, rawWebhookId={}, dedupKey={}, result={}, errorCode={}",
            command.correlationId(), command.provider(), rawWebhook.getId(),
            outcome.dedupKey(), outcome.result(), outcome.errorCode());
        return outcome;
    }

    /**
     * 저장된 원문으로 다시 처리 (재처리 스케줄러)
     * 실패해도 새 재처리 작업을 만들지 않는다. 백오프는 호출자가 관리한다.
     */
    public WebhookOutcome reprocess(Long rawWebhookId) {
        RawWebhook rawWebhook = webhookStoreService.findById(rawWebhookId);
        WebhookOutcome outcome = process(rawWebhook, false);

        metricsCollector.recordWebhook(outcome.result());
        log.info("Webhook reprocessed: rawWebhookId={}, dedupKey={}, result={}, errorCode={}",
            rawWebhookId, outcome.dedupKey(), outcome.result(), outcome.errorCode());
        return outcome;
    }

    private WebhookOutcome process(RawWebhook rawWebhook, boolean enqueueOnFailure) {
        Long rawWebhookId = rawWebhook.getId();

        // 1. 서명 검증
        Optional<PaymentWebhookProperties.Provider> provider = properties.findProvider(rawWebhook.getProvider());
        if (provider.isEmpty()) {
            return reject(rawWebhook, ErrorCode.UNKNOWN_PROVIDER, "등록되지 않은 제공자: " + rawWebhook.getProvider());
        }
        Map<Integer, String> saltKeys = provider.get().getSaltKeys();
        if (!signatureVerifier.verify(rawWebhook.getRawPayload(), rawWebhook.getSignature(), rawWebhook.getKeyIndex(), saltKeys)) {
            log.warn("Webhook signature invalid: rawWebhookId={}, provider={}, correlationId={}",
                rawWebhookId, rawWebhook.getProvider(), rawWebhook.getCorrelationId());
            return reject(rawWebhook, ErrorCode.SIGNATURE_INVALID, ErrorCode.SIGNATURE_INVALID.getMessage());
        }

        // 2. 본문 해석
        ParsedWebhook parsed;
        try {
            parsed = payloadParser.parse(rawWebhook.getRawPayload());
        } catch (BusinessException e) {
            log.warn("Webhook payload malformed: rawWebhookId={}, reason={}", rawWebhookId, e.getMessage());
            return reject(rawWebhook, e.getErrorCode(), e.getMessage());
        }
        rawWebhook.attachParsed(parsed.providerTransactionId(), parsed.reportedState(), parsed.amount());
        String dedupKey = rawWebhook.getDedupKey();

        if (parsed.state() == PaymentState.PENDING) {
            rawWebhook.ignore(null);
            webhookStoreService.save(rawWebhook);
            return WebhookOutcome.of(WebhookResult.IGNORED, rawWebhookId, dedupKey, null,
                "처리 대상이 아닌 상태: " + parsed.reportedState());
        }

        // 3. 주문 조회
        Optional<Order> found = orderRepository.findByProviderTransactionId(parsed.providerTransactionId());
        if (found.isEmpty()) {
            log.warn("Webhook for unknown transaction: rawWebhookId={}, providerTransactionId={}",
                rawWebhookId, parsed.providerTransactionId());
            rawWebhook.ignore(ErrorCode.ORDER_NOT_FOUND);
            webhookStoreService.save(rawWebhook);
            return WebhookOutcome.failed(WebhookResult.IGNORED, rawWebhookId, dedupKey, null,
                ErrorCode.ORDER_NOT_FOUND, ErrorCode.ORDER_NOT_FOUND.getMessage());
        }
        Order order = found.get();

        // 4. 금액 검증 (상태 변경 전)
        try {
            amountGuard.check(parsed, order);
        } catch (BusinessException e) {
            log.warn("Webhook amount rejected: rawWebhookId={}, orderId={}, errorCode={}, reason={}",
                rawWebhookId, order.getId(), e.getErrorCode().getCode(), e.getMessage());
            return reject(rawWebhook, e.getErrorCode(), e.getMessage());
        }

        // 5. claim
        ClaimResult claim = webhookStoreService.claim(dedupKey, rawWebhookId);
        if (!claim.won()) {
            rawWebhook.markDuplicate();
            webhookStoreService.save(rawWebhook);
            return WebhookOutcome.failed(WebhookResult.DUPLICATE, rawWebhookId, dedupKey, order.getId(),
                ErrorCode.DUPLICATE_WEBHOOK, claim.cachedResult());
        }
        rawWebhook.markClaimed(claim.claimedBy(), LocalDateTime.now());
        webhookStoreService.save(rawWebhook);

        // 6. 주문 전이
        return transition(rawWebhook, parsed, order, claim, enqueueOnFailure);
    }

    private WebhookOutcome transition(RawWebhook rawWebhook, ParsedWebhook parsed, Order order,
                                      ClaimResult claim, boolean enqueueOnFailure) {
        Long rawWebhookId = rawWebhook.getId();
        String dedupKey = claim.dedupKey();

        try {
            TransitionResult result = parsed.state() == PaymentState.SUCCESS
                ? orderTransitionService.confirm(order.getId(), parsed.providerTransactionId())
                : orderTransitionService.cancel(order.getId(), parsed.providerTransactionId(), parsed.reportedState());

            webhookStoreService.complete(claim, result.name());
            rawWebhook.complete(WebhookResult.PROCESSED);
            webhookStoreService.save(rawWebhook);
            return WebhookOutcome.of(WebhookResult.PROCESSED, rawWebhookId, dedupKey, order.getId(), result.name());

        } catch (BusinessException e) {
            if (e.getErrorCode() == ErrorCode.RESERVATION_INCONSISTENT) {
                webhookStoreService.park(claim, e.getErrorCode());
                rawWebhook.markManualReview(e.getErrorCode());
                webhookStoreService.save(rawWebhook);
                reconciliationService.enqueueManualReview(rawWebhook, e.getErrorCode(), e.getMessage());
                return WebhookOutcome.failed(WebhookResult.MANUAL_REVIEW, rawWebhookId, dedupKey, order.getId(),
                    e.getErrorCode(), e.getMessage());
            }
            if (!e.isRetryable()) {
                log.warn("Webhook not applicable: rawWebhookId={}, orderId={}, errorCode={}, reason={}",
                    rawWebhookId, order.getId(), e.getErrorCode().getCode(), e.getMessage());
                webhookStoreService.complete(claim, e.getErrorCode().getCode());
                rawWebhook.ignore(e.getErrorCode());
                webhookStoreService.save(rawWebhook);
                return WebhookOutcome.failed(WebhookResult.IGNORED, rawWebhookId, dedupKey, order.getId(),
                    e.getErrorCode(), e.getMessage());
            }
            return queue(rawWebhook, claim, order, e.getErrorCode(), e, enqueueOnFailure);

        } catch (DataAccessException | TransactionException e) {
            return queue(rawWebhook, claim, order, ErrorCode.STORE_UNAVAILABLE, e, enqueueOnFailure);
        } catch (RuntimeException e) {
            return queue(rawWebhook, claim, order, ErrorCode.INTERNAL_SERVER_ERROR, e, enqueueOnFailure);
        }
    }

    private WebhookOutcome queue(RawWebhook rawWebhook, ClaimResult claim, Order order,
                                 ErrorCode errorCode, Exception cause, boolean enqueueOnFailure) {
        log.error("Webhook processing failed, will retry: rawWebhookId={}, dedupKey={}, orderId={}, errorCode={}",
            rawWebhook.getId(), claim.dedupKey(), order.getId(), errorCode.getCode(), cause);

        webhookStoreService.fail(claim, errorCode);
        rawWebhook.markQueued(errorCode);
        webhookStoreService.save(rawWebhook);
        if (enqueueOnFailure) {
            reconciliationService.enqueueRetry(rawWebhook, errorCode, cause.getMessage());
        }
        return WebhookOutcome.failed(WebhookResult.QUEUED, rawWebhook.getId(), claim.dedupKey(), order.getId(),
            errorCode, cause.getMessage());
    }

    private WebhookOutcome reject(RawWebhook rawWebhook, ErrorCode errorCode, String message) {
        rawWebhook.reject(errorCode);
        webhookStoreService.save(rawWebhook);
        return WebhookOutcome.failed(WebhookResult.REJECTED, rawWebhook.getId(), rawWebhook.getDedupKey(), null,
            errorCode, message);
    }
}
