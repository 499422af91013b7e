package io.hhplus.checkout.infrastructure.kafka.producer;

import io.hhplus.checkout.infrastructure.kafka.message.OrderCancelledMessage;
import io.hhplus.checkout.infrastructure.kafka.message.OrderConfirmedMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderEventProducer 테스트")
class OrderEventProducerTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private OrderEventProducer orderEventProducer;

    @BeforeEach
    void setUp() {
        orderEventProducer = new OrderEventProducer(kafkaTemplate);
    }

    @Test
    @DisplayName("주문 확정 메시지를 거래 ID 키로 order-confirmed 에 발행한다")
    void publishOrderConfirmed() {
        // given
        OrderConfirmedMessage message = new OrderConfirmedMessage(
            1L, "ORD-20261019-ABC123", "TXN-1", "CS-1", 50000L, "INR", LocalDateTime.now());
        when(kafkaTemplate.send(eq("order-confirmed"), eq("TXN-1"), any(OrderConfirmedMessage.class)))
            .thenReturn(new CompletableFuture<>());

        // when
        orderEventProducer.publishOrderConfirmed(message);

        // then
        verify(kafkaTemplate, times(1)).send("order-confirmed", "TXN-1", message);
    }

    @Test
    @DisplayName("주문 취소 메시지를 order-cancelled 에 발행한다")
    void publishOrderCancelled() {
        // given
        OrderCancelledMessage message = new OrderCancelledMessage(
            2L, "ORD-20261019-DEF456", "TXN-2", "CS-2", "PAYMENT_DECLINED", LocalDateTime.now());
        when(kafkaTemplate.send(eq("order-cancelled"), eq("TXN-2"), any(OrderCancelledMessage.class)))
            .thenReturn(new CompletableFuture<>());

        // when
        orderEventProducer.publishOrderCancelled(message);

        // then
        verify(kafkaTemplate, times(1)).send("order-cancelled", "TXN-2", message);
    }

    @Test
    @DisplayName("브로커 전송 실패는 로그만 남기고 호출자에게 전파하지 않는다")
    void publish_실패() {
        // given
        OrderConfirmedMessage message = new OrderConfirmedMessage(
            3L, "ORD-20261019-GHI789", "TXN-3", "CS-3", 50000L, "INR", LocalDateTime.now());
        CompletableFuture<SendResult<String, Object>> failed =
            CompletableFuture.failedFuture(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(eq("order-confirmed"), eq("TXN-3"), any(OrderConfirmedMessage.class)))
            .thenReturn(failed);

        // when & then
        assertThatCode(() -> orderEventProducer.publishOrderConfirmed(message))
            .doesNotThrowAnyException();
    }
}
