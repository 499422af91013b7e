package io.hhplus.checkout.domain.webhook;

import java.time.LocalDateTime;
import java.util.Optional;

public interface WebhookClaimRepository {

    /**
     * 즉시 INSERT. 동일 dedupKey가 있으면 DataIntegrityViolationException.
     */
    WebhookClaim saveAndFlush(WebhookClaim claim);

    Optional<WebhookClaim> findByDedupKey(String dedupKey);

    /**
     * FAILED 또는 staleBefore 이전에 선점된 PROCESSING 을 다시 PROCESSING 으로 선점
     * @return 1: 재선점 성공, 0: 다른 상태
     */
    int reclaim(String dedupKey, String claimedBy, Long rawWebhookId, LocalDateTime now, LocalDateTime staleBefore);

    /**
     * 선점자 본인의 PROCESSING 을 종료 상태로 전이
     */
    int finish(String dedupKey, String claimedBy, ClaimStatus to, String result, LocalDateTime now);

    long countByStatus(ClaimStatus status);
}
