package io.hhplus.checkout.application.stock.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RestockRequest(
    @NotBlank(message = "상품 ID는 필수입니다")
    String productId,

    @NotBlank(message = "사이즈는 필수입니다")
    String size,

    @NotNull(message = "수량은 필수입니다")
    @Min(value = 1, message = "수량은 1개 이상이어야 합니다")
    Integer quantity
) {
}
