package io.hhplus.checkout.domain.reconciliation;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 웹훅 처리 내부 실패 기록
 *
 * 유형:
 * - WEBHOOK_RETRY: 일시 장애. 스케줄러가 저장된 원문으로 다시 처리 (1분, 2분, 4분 백오프, 3회 후 FAILED)
 * - MANUAL_REVIEW: 예약 불일치. 자동 재시도 없이 운영자 확인 대기
 *
 * 상태:
 * - PENDING → RETRYING → {SUCCESS, PENDING, FAILED}
 * - AWAITING_OPERATOR → RESOLVED
 */
@Entity
@Table(name = "reconciliation_tasks", indexes = {
    @Index(name = "idx_reconciliation_status_next", columnList = "status, next_retry_at"),
    @Index(name = "idx_reconciliation_raw_webhook", columnList = "raw_webhook_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReconciliationTask {

    private static final int MAX_RETRY_COUNT = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskType type;

    @Column(name = "raw_webhook_id", nullable = false)
    private Long rawWebhookId;

    @Column(name = "dedup_key", length = 200)
    private String dedupKey;

    @Column(name = "error_code", nullable = false, length = 30)
    private String errorCode;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskStatus status;

    @Column(name = "next_retry_at")
    private LocalDateTime nextRetryAt;

    @Column(name = "resolution_note", length = 500)
    private String resolutionNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    // ===== 생성 메서드 =====

    public static ReconciliationTask retry(Long rawWebhookId, String dedupKey, String errorCode, String errorMessage) {
        ReconciliationTask task = base(TaskType.WEBHOOK_RETRY, rawWebhookId, dedupKey, errorCode, errorMessage);
        task.status = TaskStatus.PENDING;
        task.nextRetryAt = task.createdAt.plusMinutes(1);  // 1분 후 재시도
        return task;
    }

    public static ReconciliationTask manualReview(Long rawWebhookId, String dedupKey, String errorCode, String errorMessage) {
        ReconciliationTask task = base(TaskType.MANUAL_REVIEW, rawWebhookId, dedupKey, errorCode, errorMessage);
        task.status = TaskStatus.AWAITING_OPERATOR;
        task.nextRetryAt = null;
        return task;
    }

    private static ReconciliationTask base(TaskType type, Long rawWebhookId, String dedupKey,
                                           String errorCode, String errorMessage) {
        ReconciliationTask task = new ReconciliationTask();
        task.type = type;
        task.rawWebhookId = rawWebhookId;
        task.dedupKey = dedupKey;
        task.errorCode = errorCode;
        task.errorMessage = errorMessage;
        task.retryCount = 0;
        task.createdAt = LocalDateTime.now();
        task.updatedAt = task.createdAt;
        return task;
    }

    // ===== 비즈니스 로직 =====

    public void startRetry() {
        if (this.status != TaskStatus.PENDING) {
            throw new IllegalStateException("재시도 가능한 상태가 아닙니다: " + this.status);
        }

        this.status = TaskStatus.RETRYING;
        this.retryCount++;
        this.updatedAt = LocalDateTime.now();
    }

    public void markSuccess() {
        this.status = TaskStatus.SUCCESS;
        this.updatedAt = LocalDateTime.now();
        this.nextRetryAt = null;
    }

    public void markRetryFailed(String errorMessage) {
        this.errorMessage = errorMessage;
        this.updatedAt = LocalDateTime.now();

        if (this.retryCount >= MAX_RETRY_COUNT) {
            // 최대 재시도 초과 → 운영자 확인 대상 (dead letter)
            this.status = TaskStatus.FAILED;
            this.nextRetryAt = null;
        } else {
            this.status = TaskStatus.PENDING;
            // Exponential Backoff: 1분, 2분, 4분
            long delayMinutes = (long) Math.pow(2, this.retryCount - 1);
            this.nextRetryAt = LocalDateTime.now().plusMinutes(delayMinutes);
        }
    }

    public void resolve(String note) {
        if (this.status != TaskStatus.AWAITING_OPERATOR && this.status != TaskStatus.FAILED) {
            throw new IllegalStateException("운영자 처리 대상이 아닙니다: " + this.status);
        }
        this.status = TaskStatus.RESOLVED;
        this.resolutionNote = note;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean canRetry(LocalDateTime now) {
        return this.status == TaskStatus.PENDING
            && this.retryCount < MAX_RETRY_COUNT
            && this.nextRetryAt != null
            && !now.isBefore(this.nextRetryAt);
    }

    public boolean needsOperator() {
        return this.status == TaskStatus.AWAITING_OPERATOR || this.status == TaskStatus.FAILED;
    }

    // ===== Enum =====

    public enum TaskType {
        WEBHOOK_RETRY,
        MANUAL_REVIEW
    }

    public enum TaskStatus {
        PENDING,            // 재시도 대기
        RETRYING,           // 재시도 중
        SUCCESS,            // 재처리 성공
        FAILED,             // 최대 재시도 초과
        AWAITING_OPERATOR,  // 운영자 확인 대기
        RESOLVED            // 운영자 처리 완료
    }
}
