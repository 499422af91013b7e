package io.hhplus.checkout.common.exception;

import lombok.Getter;

/**
 * 비즈니스 로직 예외
 * 도메인/애플리케이션 계층에서 발생하는 규칙 위반을 ErrorCode와 함께 전달한다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String customMessage) {
        super(customMessage);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
