package io.hhplus.checkout.application.reconciliation.dto;

import io.hhplus.checkout.domain.reconciliation.ReconciliationTask;

import java.time.LocalDateTime;

public record ReconciliationTaskResponse(
    Long taskId,
    String type,
    String status,
    Long rawWebhookId,
    String dedupKey,
    String errorCode,
    String errorMessage,
    int retryCount,
    LocalDateTime nextRetryAt,
    String resolutionNote,
    LocalDateTime createdAt
) {
    public static ReconciliationTaskResponse from(ReconciliationTask task) {
        return new ReconciliationTaskResponse(
            task.getId(),
            task.getType().name(),
            task.getStatus().name(),
            task.getRawWebhookId(),
            task.getDedupKey(),
            task.getErrorCode(),
            task.getErrorMessage(),
            task.getRetryCount(),
            task.getNextRetryAt(),
            task.getResolutionNote(),
            task.getCreatedAt()
        );
    }
}
