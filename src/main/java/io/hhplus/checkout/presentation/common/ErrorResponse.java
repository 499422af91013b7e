package io.hhplus.checkout.presentation.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ErrorResponse {

    private final String code;
    private final String message;
    private final boolean retryable;
    private final Object details;

    public static ErrorResponse of(String code, String message, boolean retryable) {
        return new ErrorResponse(code, message, retryable, null);
    }

    public static ErrorResponse of(String code, String message, boolean retryable, Object details) {
        return new ErrorResponse(code, message, retryable, details);
    }
}
