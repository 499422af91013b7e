package io.hhplus.checkout.domain.webhook;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * 수신한 웹훅 원문 기록 (전달 1건 = 1행)
 *
 * - 서명 검증 전에 먼저 저장한다. 위조 요청도 processed=false, REJECTED 로 남는다.
 * - 삭제하지 않는다.
 * - 동일 dedupKey 중 processed=true 는 claim을 획득한 1건뿐이다.
 */
@Entity
@Table(
    name = "raw_webhooks",
    indexes = {
        @Index(name = "idx_raw_webhook_dedup", columnList = "dedup_key"),
        @Index(name = "idx_raw_webhook_txn", columnList = "provider_transaction_id"),
        @Index(name = "idx_raw_webhook_received", columnList = "received_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RawWebhook extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 30)
    private String provider;

    /**
     * provider:providerTransactionId:STATE (본문 해석 실패 시 null)
     */
    @Column(name = "dedup_key", length = 200)
    private String dedupKey;

    @Column(name = "provider_transaction_id", length = 100)
    private String providerTransactionId;

    @Column(name = "reported_state", length = 40)
    private String reportedState;

    @Column
    private Long amount;

    /**
     * 서명 헤더 원문
     */
    @Column(length = 300)
    private String signature;

    /**
     * 별도 헤더로 전달된 키 인덱스 (서명 값에 ###index 가 없는 경우)
     */
    @Column(name = "key_index", length = 10)
    private String keyIndex;

    /**
     * 수신 본문 (바이트 단위 그대로)
     */
    @Column(name = "raw_payload", nullable = false, columnDefinition = "TEXT")
    private String rawPayload;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    @Column(name = "received_at", nullable = false)
    private LocalDateTime receivedAt;

    @Column(name = "claimed_by", length = 100)
    private String claimedBy;

    @Column(nullable = false)
    private boolean processed;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WebhookResult result;

    @Column(name = "error_code", length = 30)
    private String errorCode;

    public static RawWebhook receive(String provider, String rawPayload, String signature,
                                     String keyIndex, String correlationId, LocalDateTime receivedAt) {
        if (provider == null || provider.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "제공자는 필수입니다");
        }

        RawWebhook webhook = new RawWebhook();
        webhook.provider = provider.toLowerCase(Locale.ROOT);
        webhook.rawPayload = rawPayload == null ? "" : rawPayload;
        webhook.signature = signature;
        webhook.keyIndex = keyIndex;
        webhook.correlationId = correlationId;
        webhook.receivedAt = receivedAt;
        webhook.processed = false;
        webhook.result = WebhookResult.RECEIVED;
        return webhook;
    }

    public static String dedupKeyOf(String provider, String providerTransactionId, String reportedState) {
        return provider.toLowerCase(Locale.ROOT) + ":" + providerTransactionId + ":" + reportedState.toUpperCase(Locale.ROOT);
    }

    public void attachParsed(String providerTransactionId, String reportedState, Long amount) {
        this.providerTransactionId = providerTransactionId;
        this.reportedState = reportedState;
        this.amount = amount;
        this.dedupKey = dedupKeyOf(provider, providerTransactionId, reportedState);
    }

    public void reject(ErrorCode errorCode) {
        this.processed = false;
        this.result = WebhookResult.REJECTED;
        this.errorCode = errorCode.getCode();
    }

    public void ignore(ErrorCode errorCode) {
        this.result = WebhookResult.IGNORED;
        this.errorCode = errorCode == null ? null : errorCode.getCode();
    }

    public void markDuplicate() {
        this.processed = false;
        this.result = WebhookResult.DUPLICATE;
        this.errorCode = ErrorCode.DUPLICATE_WEBHOOK.getCode();
    }

    /**
     * claim 획득. 이 전달만 processed=true 가 된다.
     */
    public void markClaimed(String claimedBy, LocalDateTime now) {
        this.claimedBy = claimedBy;
        this.processed = true;
        this.processedAt = now;
        this.errorCode = null;
    }

    public void complete(WebhookResult result) {
        this.result = result;
    }

    /**
     * 일시 장애. 재처리가 다시 claim을 획득하므로 processed를 내린다.
     */
    public void markQueued(ErrorCode errorCode) {
        this.processed = false;
        this.result = WebhookResult.QUEUED;
        this.errorCode = errorCode.getCode();
    }

    public void markManualReview(ErrorCode errorCode) {
        this.processed = false;
        this.result = WebhookResult.MANUAL_REVIEW;
        this.errorCode = errorCode.getCode();
    }

    public boolean hasSignature() {
        return signature != null && !signature.isBlank();
    }
}
