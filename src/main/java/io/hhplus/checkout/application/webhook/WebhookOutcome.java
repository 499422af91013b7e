package io.hhplus.checkout.application.webhook;

import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.webhook.WebhookResult;

/**
 * 내부 처리 결과. 제공자 응답(WebhookAck)과는 별개로 로그/메트릭/재처리에 쓰인다.
 */
public record WebhookOutcome(
    WebhookResult result,
    Long rawWebhookId,
    String dedupKey,
    Long orderId,
    String errorCode,
    String message
) {
    public static WebhookOutcome of(WebhookResult result, Long rawWebhookId, String dedupKey,
                                    Long orderId, String message) {
        return new WebhookOutcome(result, rawWebhookId, dedupKey, orderId, null, message);
    }

    public static WebhookOutcome failed(WebhookResult result, Long rawWebhookId, String dedupKey,
                                        Long orderId, ErrorCode errorCode, String message) {
        return new WebhookOutcome(result, rawWebhookId, dedupKey, orderId, errorCode.getCode(), message);
    }

    /**
     * 재처리 큐에 다시 넣어야 하는 결과인지
     */
    public boolean needsRetry() {
        return result == WebhookResult.QUEUED;
    }
}
