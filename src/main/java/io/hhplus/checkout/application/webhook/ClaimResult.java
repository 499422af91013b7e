package io.hhplus.checkout.application.webhook;

import io.hhplus.checkout.domain.webhook.WebhookClaim;

/**
 * claim 시도 결과
 *
 * @param won       이 전달이 처리 권한을 얻었는지
 * @param claim     현재 claim 행 (진 경우 캐시된 결과 포함)
 * @param claimedBy 이 전달의 소유자 식별자
 */
public record ClaimResult(boolean won, WebhookClaim claim, String claimedBy) {

    public static ClaimResult won(WebhookClaim claim, String claimedBy) {
        return new ClaimResult(true, claim, claimedBy);
    }

    public static ClaimResult lost(WebhookClaim claim, String claimedBy) {
        return new ClaimResult(false, claim, claimedBy);
    }

    public String dedupKey() {
        return claim.getDedupKey();
    }

    /**
     * 진 전달에 돌려줄 선점자의 처리 결과 (아직 처리 중이면 PROCESSING)
     */
    public String cachedResult() {
        return claim.getResult() != null ? claim.getResult() : claim.getStatus().name();
    }
}
