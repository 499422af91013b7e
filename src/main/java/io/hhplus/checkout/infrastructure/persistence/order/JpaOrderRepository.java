package io.hhplus.checkout.infrastructure.persistence.order;

import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderRepository;
import io.hhplus.checkout.domain.order.OrderStatus;
import io.hhplus.checkout.domain.order.PaymentStatus;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 주문 JPA Repository
 *
 * 상태 전이는 DRAFT 조건이 붙은 UPDATE 한 문장으로 처리한다.
 * 영향받은 행 수가 0이면 다른 전달이 이미 종료 상태로 만든 것이다.
 */
@Repository
@Primary
public interface JpaOrderRepository extends JpaRepository<Order, Long>, OrderRepository {

    @Override
    Order save(Order order);

    @Override
    Optional<Order> findById(Long id);

    @Override
    List<Order> findAll();

    @Override
    Optional<Order> findByOrderNumber(String orderNumber);

    @Override
    Optional<Order> findByProviderTransactionId(String providerTransactionId);

    @Override
    default int confirmIfDraft(Long orderId, LocalDateTime now) {
        return confirmOrder(orderId, OrderStatus.DRAFT, OrderStatus.CONFIRMED, PaymentStatus.PAID, now);
    }

    @Override
    default int cancelIfDraft(Long orderId, LocalDateTime now) {
        return cancelOrder(orderId, OrderStatus.DRAFT, OrderStatus.CANCELLED, PaymentStatus.FAILED, now);
    }

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = :confirmed, o.paymentStatus = :paid, o.paidAt = :now " +
           "WHERE o.id = :orderId AND o.status = :draft")
    int confirmOrder(@Param("orderId") Long orderId,
                     @Param("draft") OrderStatus draft,
                     @Param("confirmed") OrderStatus confirmed,
                     @Param("paid") PaymentStatus paid,
                     @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = :cancelled, o.paymentStatus = :failed, o.cancelledAt = :now " +
           "WHERE o.id = :orderId AND o.status = :draft")
    int cancelOrder(@Param("orderId") Long orderId,
                    @Param("draft") OrderStatus draft,
                    @Param("cancelled") OrderStatus cancelled,
                    @Param("failed") PaymentStatus failed,
                    @Param("now") LocalDateTime now);
}
