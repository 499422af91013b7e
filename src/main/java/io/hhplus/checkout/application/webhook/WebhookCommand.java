package io.hhplus.checkout.application.webhook;

/**
 * 웹훅 수신 요청 (본문은 받은 그대로)
 */
public record WebhookCommand(
    String provider,
    String rawPayload,
    String signature,
    String keyIndex,
    String correlationId
) {
    public boolean hasSignature() {
        return signature != null && !signature.isBlank();
    }
}
