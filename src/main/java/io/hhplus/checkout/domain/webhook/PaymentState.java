package io.hhplus.checkout.domain.webhook;

import java.util.Locale;
import java.util.Set;

/**
 * 제공자가 보고한 결제 상태 분류
 */
public enum PaymentState {
    SUCCESS,
    FAILURE,
    PENDING;

    private static final Set<String> SUCCESS_STATES = Set.of(
        "COMPLETED", "SUCCESS", "PAYMENT_SUCCESS", "PAID", "CAPTURED"
    );

    private static final Set<String> FAILURE_STATES = Set.of(
        "FAILED", "PAYMENT_ERROR", "PAYMENT_DECLINED", "CANCELLED",
        "TIMED_OUT", "TIMEOUT", "DECLINED", "ERROR"
    );

    /**
     * 분류되지 않는 값은 모두 PENDING (기록만 하고 반영하지 않음)
     */
    public static PaymentState categorize(String reportedState) {
        if (reportedState == null) {
            return PENDING;
        }
        String normalized = reportedState.trim().toUpperCase(Locale.ROOT);
        if (SUCCESS_STATES.contains(normalized)) {
            return SUCCESS;
        }
        if (FAILURE_STATES.contains(normalized)) {
            return FAILURE;
        }
        return PENDING;
    }
}
