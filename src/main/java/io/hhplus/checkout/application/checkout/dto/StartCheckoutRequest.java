package io.hhplus.checkout.application.checkout.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record StartCheckoutRequest(
    @Email(message = "이메일 형식이 올바르지 않습니다")
    String userEmail,

    String currency,

    @NotEmpty(message = "주문 상품은 최소 1개 이상이어야 합니다")
    @Valid
    List<CheckoutItemRequest> items
) {}
