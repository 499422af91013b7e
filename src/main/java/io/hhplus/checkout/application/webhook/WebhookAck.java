package io.hhplus.checkout.application.webhook;

/**
 * 결제 제공자에게 돌려주는 응답 본문 (항상 HTTP 200)
 *
 * @param retryable 제공자가 같은 웹훅을 다시 보내도 되는지
 */
public record WebhookAck(
    boolean success,
    String message,
    boolean retryable
) {
    public static WebhookAck ok(String message) {
        return new WebhookAck(true, message, false);
    }

    public static WebhookAck rejected(String message) {
        return new WebhookAck(false, message, false);
    }

    public static WebhookAck accepted(String message) {
        return new WebhookAck(true, message, true);
    }

    public static WebhookAck retryLater(String message) {
        return new WebhookAck(false, message, true);
    }
}
