package io.hhplus.checkout.application.webhook;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.config.PaymentWebhookProperties;
import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.webhook.PaymentState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 결제 금액 검증 (상태 변경 전에 수행)
 *
 * - SUCCESS: 금액 필수, 0 초과, 상한 이하, 주문 금액과 허용 오차 이내
 * - FAILURE: 금액이 있을 때만 검사. 실패 결제는 0을 보고할 수 있다.
 */
@Component
@RequiredArgsConstructor
public class AmountGuard {

    private final PaymentWebhookProperties properties;

    /**
     * @throws BusinessException FRAUD_SUSPECTED 범위 밖 금액, AMOUNT_MISMATCH 주문 금액 불일치
     */
    public void check(ParsedWebhook webhook, Order order) {
        Long amount = webhook.amount();

        if (webhook.state() == PaymentState.FAILURE) {
            if (amount == null || amount == 0L) {
                return;
            }
            checkRange(amount);
            checkMatches(amount, order);
            return;
        }

        if (amount == null) {
            throw new BusinessException(ErrorCode.FRAUD_SUSPECTED, "결제 금액이 없습니다");
        }
        checkRange(amount);
        checkMatches(amount, order);
    }

    private void checkRange(long amount) {
        if (amount <= 0) {
            throw new BusinessException(ErrorCode.FRAUD_SUSPECTED, "결제 금액은 0보다 커야 합니다. amount: " + amount);
        }
        if (amount > properties.getMaxAmount()) {
            throw new BusinessException(
                ErrorCode.FRAUD_SUSPECTED,
                String.format("결제 금액이 상한을 초과했습니다. amount: %d, max: %d", amount, properties.getMaxAmount())
            );
        }
    }

    private void checkMatches(long amount, Order order) {
        if (order == null || !order.isDraft()) {
            return;
        }
        long difference = Math.abs(amount - order.getTotalAmount());
        if (difference > properties.getAmountTolerance()) {
            throw new BusinessException(
                ErrorCode.AMOUNT_MISMATCH,
                String.format("결제 금액이 주문 금액과 다릅니다. reported: %d, expected: %d",
                    amount, order.getTotalAmount())
            );
        }
    }
}
