package io.hhplus.checkout.infrastructure.kafka.producer;

import io.hhplus.checkout.infrastructure.kafka.message.OrderCancelledMessage;
import io.hhplus.checkout.infrastructure.kafka.message.OrderConfirmedMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class OrderEventProducer {

    public static final String ORDER_CONFIRMED_TOPIC = "order-confirmed";
    public static final String ORDER_CANCELLED_TOPIC = "order-cancelled";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public void publishOrderConfirmed(OrderConfirmedMessage message) {
        send(ORDER_CONFIRMED_TOPIC, message.providerTransactionId(), message, message.orderId());
    }

    public void publishOrderCancelled(OrderCancelledMessage message) {
        send(ORDER_CANCELLED_TOPIC, message.providerTransactionId(), message, message.orderId());
    }

    // 같은 거래의 메시지는 같은 파티션으로 (키 = providerTransactionId)
    private void send(String topic, String key, Object message, Long orderId) {
        kafkaTemplate.send(topic, key, message)
            .whenComplete((result, ex) -> {
                if (ex == null) {
                    var metadata = result.getRecordMetadata();
                    log.info("Kafka message published: orderId={}, topic={}, partition={}, offset={}",
                        orderId,
                        metadata.topic(),
                        metadata.partition(),
                        metadata.offset()
                    );
                } else {
                    log.error("Failed to publish Kafka message: orderId={}, topic={}, error={}",
                        orderId,
                        topic,
                        ex.getMessage(),
                        ex
                    );
                }
            });
    }
}
