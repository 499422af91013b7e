package io.hhplus.checkout.application.webhook;

import io.hhplus.checkout.domain.webhook.PaymentState;

/**
 * 제공자 본문에서 추출한 값
 *
 * @param amount 보고 금액 (minor unit). 본문에 없으면 null
 */
public record ParsedWebhook(
    String providerTransactionId,
    String reportedState,
    PaymentState state,
    Long amount,
    String currency,
    String timestamp
) {
    public boolean hasAmount() {
        return amount != null;
    }
}
