package io.hhplus.checkout.application.listener;

import io.hhplus.checkout.domain.order.OrderCancelledEvent;
import io.hhplus.checkout.domain.order.OrderConfirmedEvent;
import io.hhplus.checkout.infrastructure.kafka.message.OrderCancelledMessage;
import io.hhplus.checkout.infrastructure.kafka.message.OrderConfirmedMessage;
import io.hhplus.checkout.infrastructure.kafka.producer.OrderEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문 확정/취소를 외부 알림 서비스로 전달 (Kafka)
 *
 * 커밋 이후 비동기로 실행되므로 웹훅 처리 결과에 영향을 주지 않는다.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "checkout.events.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class OrderEventRelayListener {

    private final OrderEventProducer orderEventProducer;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Retryable(
        maxAttempts = 3,
        backoff = @Backoff(delay = 1000, multiplier = 2),
        retryFor = {RuntimeException.class}
    )
    public void handleOrderConfirmed(OrderConfirmedEvent event) {
        log.info("Relaying order confirmed: orderId={}, providerTransactionId={}",
            event.getOrderId(), event.getProviderTransactionId());
        orderEventProducer.publishOrderConfirmed(OrderConfirmedMessage.from(event));
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Retryable(
        maxAttempts = 3,
        backoff = @Backoff(delay = 1000, multiplier = 2),
        retryFor = {RuntimeException.class}
    )
    public void handleOrderCancelled(OrderCancelledEvent event) {
        log.info("Relaying order cancelled: orderId={}, providerTransactionId={}, reportedState={}",
            event.getOrderId(), event.getProviderTransactionId(), event.getReportedState());
        orderEventProducer.publishOrderCancelled(OrderCancelledMessage.from(event));
    }

    @Recover
    public void recoverConfirmed(RuntimeException e, OrderConfirmedEvent event) {
        log.error("[ALERT] Order confirmed relay failed after retries: orderId={}, error={}",
            event.getOrderId(), e.getMessage(), e);
    }

    @Recover
    public void recoverCancelled(RuntimeException e, OrderCancelledEvent event) {
        log.error("[ALERT] Order cancelled relay failed after retries: orderId={}, error={}",
            event.getOrderId(), e.getMessage(), e);
    }
}
