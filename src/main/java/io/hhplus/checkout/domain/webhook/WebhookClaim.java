package io.hhplus.checkout.domain.webhook;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 웹훅 처리 선점 기록 (dedupKey 당 1행)
 * <p>
 * - UNIQUE(dedup_key) 로 동시 전달 중 INSERT에 성공한 1건만 선점한다.
 * - FAILED 이거나 오래된 PROCESSING 인 경우에만 조건부 UPDATE 로 재선점할 수 있다.
 * - MANUAL_REVIEW 는 자동으로 재선점되지 않는다.
 * - 선점에 진 전달은 result(캐시된 결과)를 그대로 돌려받는다.
 */
@Entity
@Table(
    name = "webhook_claims",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_webhook_claim_dedup", columnNames = "dedup_key")
    },
    indexes = {
        @Index(name = "idx_webhook_claim_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WebhookClaim {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dedup_key", nullable = false, unique = true, length = 200)
    private String dedupKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ClaimStatus status;

    /**
     * 선점자 (workerId:rawWebhookId)
     */
    @Column(name = "claimed_by", nullable = false, length = 100)
    private String claimedBy;

    @Column(name = "raw_webhook_id", nullable = false)
    private Long rawWebhookId;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "claimed_at", nullable = false)
    private LocalDateTime claimedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    /**
     * 처리 결과 (WebhookResult 이름 또는 에러 코드)
     */
    @Column(length = 40)
    private String result;

    public static WebhookClaim start(String dedupKey, String claimedBy, Long rawWebhookId, LocalDateTime now) {
        if (dedupKey == null || dedupKey.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "dedupKey는 필수입니다");
        }
        if (dedupKey.length() > 200) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "dedupKey는 200자를 초과할 수 없습니다");
        }

        WebhookClaim claim = new WebhookClaim();
        claim.dedupKey = dedupKey;
        claim.claimedBy = claimedBy;
        claim.rawWebhookId = rawWebhookId;
        claim.status = ClaimStatus.PROCESSING;
        claim.attempts = 1;
        claim.claimedAt = now;
        return claim;
    }

    // ===== InMemory 저장소용 조건부 전이 =====

    public boolean reclaim(String claimedBy, Long rawWebhookId, LocalDateTime now, LocalDateTime staleBefore) {
        boolean reclaimable = status == ClaimStatus.FAILED
            || (status == ClaimStatus.PROCESSING && claimedAt.isBefore(staleBefore));
        if (!reclaimable) {
            return false;
        }
        this.status = ClaimStatus.PROCESSING;
        this.claimedBy = claimedBy;
        this.rawWebhookId = rawWebhookId;
        this.claimedAt = now;
        this.attempts++;
        this.completedAt = null;
        return true;
    }

    public boolean finish(String claimedBy, ClaimStatus to, String result, LocalDateTime now) {
        if (status != ClaimStatus.PROCESSING || !this.claimedBy.equals(claimedBy)) {
            return false;
        }
        this.status = to;
        this.result = result;
        this.completedAt = now;
        return true;
    }

    public boolean isCompleted() {
        return status == ClaimStatus.COMPLETED;
    }
}
