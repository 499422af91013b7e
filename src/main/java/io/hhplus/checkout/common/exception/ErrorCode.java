package io.hhplus.checkout.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 * retryable: 동일 요청을 다시 처리하면 성공할 여지가 있는지 여부
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 웹훅 관련 (W)
    // ====================================
    SIGNATURE_INVALID("W001", "웹훅 서명이 올바르지 않습니다", false),
    MISSING_SIGNATURE("W002", "웹훅 서명 헤더가 없습니다", false),
    UNKNOWN_PROVIDER("W003", "등록되지 않은 결제 제공자입니다", false),
    MALFORMED_PAYLOAD("W004", "웹훅 본문을 해석할 수 없습니다", false),
    DUPLICATE_WEBHOOK("W005", "이미 처리된 웹훅입니다", false),

    // ====================================
    // 금액 검증 관련 (F)
    // ====================================
    AMOUNT_MISMATCH("F001", "결제 금액이 주문 금액과 일치하지 않습니다", false),
    FRAUD_SUSPECTED("F002", "허용 범위를 벗어난 결제 금액입니다", false),

    // ====================================
    // 재고 관련 (S)
    // ====================================
    INSUFFICIENT_STOCK("S001", "재고가 부족합니다", false),
    RESERVATION_INCONSISTENT("S002", "예약 재고와 원장 상태가 일치하지 않습니다", false),
    STOCK_ENTRY_NOT_FOUND("S003", "재고 원장을 찾을 수 없습니다", false),
    INVALID_QUANTITY("S004", "수량은 1 이상이어야 합니다", false),

    // ====================================
    // 체크아웃 관련 (CS)
    // ====================================
    CHECKOUT_SESSION_NOT_FOUND("CS001", "체크아웃 세션을 찾을 수 없습니다", false),
    INVALID_SESSION_STATUS("CS002", "체크아웃 세션 상태가 올바르지 않습니다", false),

    // ====================================
    // 주문 관련 (O)
    // ====================================
    ORDER_NOT_FOUND("O001", "주문을 찾을 수 없습니다", false),
    INVALID_ORDER_STATUS("O002", "주문 상태가 올바르지 않습니다", false),

    // ====================================
    // 재처리 관련 (R)
    // ====================================
    RECONCILIATION_TASK_NOT_FOUND("R001", "재처리 작업을 찾을 수 없습니다", false),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    STORE_UNAVAILABLE("COMMON001", "저장소에 일시적으로 접근할 수 없습니다", true),
    INTERNAL_SERVER_ERROR("COMMON002", "서버 내부 오류가 발생했습니다", true),
    INVALID_INPUT("COMMON003", "입력값이 올바르지 않습니다", false);

    private final String code;
    private final String message;
    private final boolean retryable;
}
