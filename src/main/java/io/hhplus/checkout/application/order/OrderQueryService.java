package io.hhplus.checkout.application.order;

import io.hhplus.checkout.application.order.dto.OrderStatusResponse;
import io.hhplus.checkout.domain.order.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 스토어프론트 결제 대기 화면의 주문 상태 조회 (종료 상태가 될 때까지 폴링)
 */
@Service
@RequiredArgsConstructor
public class OrderQueryService {

    private final OrderRepository orderRepository;

    @Transactional(readOnly = true)
    public OrderStatusResponse getStatus(Long orderId) {
        return OrderStatusResponse.from(orderRepository.findByIdOrThrow(orderId));
    }
}
