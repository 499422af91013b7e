package io.hhplus.checkout.application.reconciliation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResolveTaskRequest(
    @NotBlank(message = "처리 내용은 필수입니다")
    @Size(max = 500, message = "처리 내용은 500자 이하여야 합니다")
    String note
) {}
