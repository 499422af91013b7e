package io.hhplus.checkout.application.listener;

import io.hhplus.checkout.domain.order.OrderCancelledEvent;
import io.hhplus.checkout.domain.order.OrderConfirmedEvent;
import io.hhplus.checkout.infrastructure.kafka.message.OrderCancelledMessage;
import io.hhplus.checkout.infrastructure.kafka.message.OrderConfirmedMessage;
import io.hhplus.checkout.infrastructure.kafka.producer.OrderEventProducer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;

/**
 * OrderEventRelayListener Unit Test
 *
 * 목적: 도메인 이벤트 → Kafka 메시지 변환만 검증
 * (재시도/비동기는 Spring 프록시 동작이므로 여기서 다루지 않음)
 */
@ExtendWith(MockitoExtension.class)
class OrderEventRelayListenerTest {

    @Mock
    private OrderEventProducer orderEventProducer;

    @InjectMocks
    private OrderEventRelayListener listener;

    @Test
    @DisplayName("주문 확정 이벤트를 확정 메시지로 전달")
    void handleOrderConfirmed() {
        // Given
        LocalDateTime paidAt = LocalDateTime.now();
        OrderConfirmedEvent event = new OrderConfirmedEvent(
            1L, "ORD-20261019-ABC123", "TXN-1", "CS-1", 50000L, "INR", paidAt);

        // When
        listener.handleOrderConfirmed(event);

        // Then
        ArgumentCaptor<OrderConfirmedMessage> captor = ArgumentCaptor.forClass(OrderConfirmedMessage.class);
        verify(orderEventProducer).publishOrderConfirmed(captor.capture());
        assertThat(captor.getValue().orderId()).isEqualTo(1L);
        assertThat(captor.getValue().providerTransactionId()).isEqualTo("TXN-1");
        assertThat(captor.getValue().totalAmount()).isEqualTo(50000L);
        assertThat(captor.getValue().paidAt()).isEqualTo(paidAt);
    }

    @Test
    @DisplayName("주문 취소 이벤트를 취소 메시지로 전달 (보고된 상태 포함)")
    void handleOrderCancelled() {
        // Given
        OrderCancelledEvent event = new OrderCancelledEvent(
            2L, "ORD-20261019-DEF456", "TXN-2", "CS-2", "PAYMENT_DECLINED", LocalDateTime.now());

        // When
        listener.handleOrderCancelled(event);

        // Then
        ArgumentCaptor<OrderCancelledMessage> captor = ArgumentCaptor.forClass(OrderCancelledMessage.class);
        verify(orderEventProducer).publishOrderCancelled(captor.capture());
        assertThat(captor.getValue().reportedState()).isEqualTo("PAYMENT_DECLINED");
    }

    @Test
    @DisplayName("재시도 소진 후 복구 메서드는 예외를 던지지 않는다")
    void recover() {
        OrderConfirmedEvent event = new OrderConfirmedEvent(
            3L, "ORD-20261019-GHI789", "TXN-3", "CS-3", 50000L, "INR", LocalDateTime.now());

        assertThatCode(() -> listener.recoverConfirmed(new IllegalStateException("broker down"), event))
            .doesNotThrowAnyException();
    }
}
