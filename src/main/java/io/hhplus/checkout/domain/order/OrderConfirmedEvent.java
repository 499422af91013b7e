package io.hhplus.checkout.domain.order;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 주문 확정 도메인 이벤트
 *
 * 발행 시점: 확정 트랜잭션 안에서 발행, 커밋 이후 리스너 실행
 * 처리: OrderEventRelayListener가 Kafka(order-confirmed)로 전달 → 외부 알림/메일 서비스
 *
 * 엔티티 대신 값만 담는다 (커밋 후 비동기 스레드에서 지연 로딩 불가).
 */
@Getter
@AllArgsConstructor
public class OrderConfirmedEvent {
    private final Long orderId;
    private final String orderNumber;
    private final String providerTransactionId;
    private final String checkoutSessionId;
    private final Long totalAmount;
    private final String currency;
    private final LocalDateTime paidAt;
}
