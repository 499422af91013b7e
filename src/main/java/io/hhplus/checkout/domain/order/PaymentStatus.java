package io.hhplus.checkout.domain.order;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED
}
