package io.hhplus.checkout.application.reconciliation;

import io.hhplus.checkout.application.reconciliation.dto.ReconciliationTaskResponse;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.reconciliation.ReconciliationTask;
import io.hhplus.checkout.domain.reconciliation.ReconciliationTaskRepository;
import io.hhplus.checkout.domain.webhook.RawWebhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 웹훅 처리 내부 실패 큐
 *
 * - 일시 장애: WEBHOOK_RETRY 로 쌓고 ReconciliationRetryScheduler 가 재처리
 * - 예약 불일치: MANUAL_REVIEW 로 쌓고 운영자가 처리 (자동 재시도 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private final ReconciliationTaskRepository reconciliationTaskRepository;

    public ReconciliationTask enqueueRetry(RawWebhook rawWebhook, ErrorCode errorCode, String message) {
        ReconciliationTask task = reconciliationTaskRepository.save(ReconciliationTask.retry(
            rawWebhook.getId(), rawWebhook.getDedupKey(), errorCode.getCode(), message
        ));
        log.warn("Webhook queued for retry: taskId={}, rawWebhookId={}, dedupKey={}, errorCode={}, nextRetryAt={}",
            task.getId(), rawWebhook.getId(), rawWebhook.getDedupKey(), errorCode.getCode(), task.getNextRetryAt());
        return task;
    }

    public ReconciliationTask enqueueManualReview(RawWebhook rawWebhook, ErrorCode errorCode, String message) {
        ReconciliationTask task = reconciliationTaskRepository.save(ReconciliationTask.manualReview(
            rawWebhook.getId(), rawWebhook.getDedupKey(), errorCode.getCode(), message
        ));
        log.error("[ALERT] Manual review required: taskId={}, rawWebhookId={}, dedupKey={}, errorCode={}, message={}",
            task.getId(), rawWebhook.getId(), rawWebhook.getDedupKey(), errorCode.getCode(), message);
        return task;
    }

    public List<ReconciliationTask> findDueRetries(LocalDateTime now, int limit) {
        return reconciliationTaskRepository.findRetryable(now, limit);
    }

    public ReconciliationTask startRetry(ReconciliationTask task) {
        task.startRetry();
        return reconciliationTaskRepository.save(task);
    }

    public void markRetrySucceeded(ReconciliationTask task) {
        task.markSuccess();
        reconciliationTaskRepository.save(task);
        log.info("Reconciliation retry succeeded: taskId={}, rawWebhookId={}, attempts={}",
            task.getId(), task.getRawWebhookId(), task.getRetryCount());
    }

    public void markRetryFailed(ReconciliationTask task, String errorMessage) {
        task.markRetryFailed(errorMessage);
        reconciliationTaskRepository.save(task);

        if (task.needsOperator()) {
            log.error("[ALERT] Reconciliation retries exhausted: taskId={}, rawWebhookId={}, attempts={}, error={}",
                task.getId(), task.getRawWebhookId(), task.getRetryCount(), errorMessage);
        } else {
            log.warn("Reconciliation retry failed: taskId={}, attempts={}, nextRetryAt={}, error={}",
                task.getId(), task.getRetryCount(), task.getNextRetryAt(), errorMessage);
        }
    }

    @Transactional(readOnly = true)
    public List<ReconciliationTaskResponse> listOperatorQueue() {
        return reconciliationTaskRepository.findOperatorQueue().stream()
            .map(ReconciliationTaskResponse::from)
            .toList();
    }

    @Transactional
    public ReconciliationTaskResponse resolve(Long taskId, String note) {
        ReconciliationTask task = reconciliationTaskRepository.findByIdOrThrow(taskId);
        if (!task.needsOperator()) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "운영자 처리 대상이 아닙니다. taskId: " + taskId + ", status: " + task.getStatus()
            );
        }
        task.resolve(note);
        ReconciliationTask saved = reconciliationTaskRepository.save(task);
        log.info("Reconciliation task resolved: taskId={}, note={}", taskId, note);
        return ReconciliationTaskResponse.from(saved);
    }
}
