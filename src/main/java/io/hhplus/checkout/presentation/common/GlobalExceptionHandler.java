package io.hhplus.checkout.presentation.common;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("Business exception occurred: code={}, message={}", e.getCode(), e.getMessage());

        ErrorResponse errorResponse = ErrorResponse.of(e.getCode(), e.getMessage(), e.isRetryable());
        HttpStatus status = mapErrorCodeToHttpStatus(e.getErrorCode());
        return ResponseEntity.status(status).body(ApiResponse.error(errorResponse));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        log.warn("Validation failed: {}", fieldErrors);

        ErrorResponse errorResponse = ErrorResponse.of(
                ErrorCode.INVALID_INPUT.getCode(),
                ErrorCode.INVALID_INPUT.getMessage(),
                false,
                fieldErrors
        );
        return ResponseEntity.badRequest().body(ApiResponse.error(errorResponse));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ErrorResponse errorResponse = ErrorResponse.of(
                ErrorCode.INVALID_INPUT.getCode(),
                "요청 본문을 읽을 수 없습니다",
                false
        );
        return ResponseEntity.badRequest().body(ApiResponse.error(errorResponse));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataAccessException(DataAccessException e) {
        log.error("Store unavailable", e);

        ErrorResponse errorResponse = ErrorResponse.of(
                ErrorCode.STORE_UNAVAILABLE.getCode(),
                ErrorCode.STORE_UNAVAILABLE.getMessage(),
                true
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error(errorResponse));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("Unexpected exception occurred", e);

        ErrorResponse errorResponse = ErrorResponse.of(
                ErrorCode.INTERNAL_SERVER_ERROR.getCode(),
                ErrorCode.INTERNAL_SERVER_ERROR.getMessage(),
                true
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error(errorResponse));
    }

    private HttpStatus mapErrorCodeToHttpStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case UNKNOWN_PROVIDER, MALFORMED_PAYLOAD, INVALID_QUANTITY, INVALID_INPUT,
                 AMOUNT_MISMATCH, FRAUD_SUSPECTED ->
                    HttpStatus.BAD_REQUEST;
            case MISSING_SIGNATURE, SIGNATURE_INVALID ->
                    HttpStatus.UNAUTHORIZED;
            case ORDER_NOT_FOUND, CHECKOUT_SESSION_NOT_FOUND, STOCK_ENTRY_NOT_FOUND, RECONCILIATION_TASK_NOT_FOUND ->
                    HttpStatus.NOT_FOUND;
            case INSUFFICIENT_STOCK, INVALID_SESSION_STATUS, INVALID_ORDER_STATUS,
                 DUPLICATE_WEBHOOK, RESERVATION_INCONSISTENT ->
                    HttpStatus.CONFLICT;
            case STORE_UNAVAILABLE ->
                    HttpStatus.SERVICE_UNAVAILABLE;
            default ->
                    HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
