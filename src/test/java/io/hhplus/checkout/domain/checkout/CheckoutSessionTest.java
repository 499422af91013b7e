package io.hhplus.checkout.domain.checkout;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class CheckoutSessionTest {

    @Test
    @DisplayName("세션 생성 - PENDING, 재고 미확보")
    void create_성공() {
        // When
        CheckoutSession session = CheckoutSession.create("CS-1", "a@b.com", 50000L, LocalDateTime.now().plusMinutes(15));

        // Then
        assertThat(session.getStatus()).isEqualTo(CheckoutSessionStatus.PENDING);
        assertThat(session.isStockReserved()).isFalse();
        assertThat(session.isOpen()).isTrue();
    }

    @Test
    @DisplayName("세션 금액이 0 이하이면 INVALID_INPUT")
    void create_금액오류_예외발생() {
        assertThatThrownBy(() -> CheckoutSession.create("CS-1", "a@b.com", 0L, LocalDateTime.now()))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("결제 대기 전환은 PENDING 에서만 가능")
    void markAwaitingPayment_상태검사() {
        // Given
        CheckoutSession session = CheckoutSession.create("CS-1", "a@b.com", 50000L, LocalDateTime.now().plusMinutes(15));
        session.markAwaitingPayment();

        // Then
        assertThat(session.isStockReserved()).isTrue();
        assertThatThrownBy(session::markAwaitingPayment)
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_SESSION_STATUS);
    }

    @Test
    @DisplayName("조건부 전이 - from 이 다르면 변경 없음")
    void transition_조건부() {
        // Given
        LocalDateTime now = LocalDateTime.now();
        CheckoutSession session = CheckoutSession.create("CS-1", "a@b.com", 50000L, now.plusMinutes(15));
        session.markAwaitingPayment();

        // When
        boolean wrongFrom = session.transition(CheckoutSessionStatus.PENDING, CheckoutSessionStatus.CANCELLED, now);
        boolean completed = session.transition(CheckoutSessionStatus.AWAITING_PAYMENT, CheckoutSessionStatus.COMPLETED, now);

        // Then
        assertThat(wrongFrom).isFalse();
        assertThat(completed).isTrue();
        assertThat(session.getStatus()).isEqualTo(CheckoutSessionStatus.COMPLETED);
        assertThat(session.isStockReserved()).isFalse();
        assertThat(session.getClosedAt()).isEqualTo(now);
    }
}
