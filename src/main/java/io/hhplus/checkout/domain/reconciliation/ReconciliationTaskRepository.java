package io.hhplus.checkout.domain.reconciliation;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 재처리 작업 저장소
 */
public interface ReconciliationTaskRepository {

    ReconciliationTask save(ReconciliationTask task);

    Optional<ReconciliationTask> findById(Long id);

    /**
     * status = PENDING 이고 nextRetryAt <= now 인 작업 (오래된 순)
     */
    List<ReconciliationTask> findRetryable(LocalDateTime now, int limit);

    /**
     * AWAITING_OPERATOR, FAILED 상태 작업 (운영자 확인 대상)
     */
    List<ReconciliationTask> findOperatorQueue();

    List<ReconciliationTask> findByRawWebhookId(Long rawWebhookId);

    long countByStatus(ReconciliationTask.TaskStatus status);

    default ReconciliationTask findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.RECONCILIATION_TASK_NOT_FOUND,
                "재처리 작업을 찾을 수 없습니다. taskId: " + id
            ));
    }
}
