package io.hhplus.checkout.domain.order;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface OrderRepository {

    Optional<Order> findById(Long id);

    Optional<Order> findByOrderNumber(String orderNumber);

    Optional<Order> findByProviderTransactionId(String providerTransactionId);

    List<Order> findAll();

    Order save(Order order);

    /**
     * DRAFT → CONFIRMED / PAID 조건부 전이
     * @return 1: 이 호출이 확정함, 0: 이미 종료 상태
     */
    int confirmIfDraft(Long orderId, LocalDateTime now);

    /**
     * DRAFT → CANCELLED / FAILED 조건부 전이
     */
    int cancelIfDraft(Long orderId, LocalDateTime now);

    default Order findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.ORDER_NOT_FOUND,
                "주문을 찾을 수 없습니다. orderId: " + id
            ));
    }
}
