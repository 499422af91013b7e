package io.hhplus.checkout.application.order;

import io.hhplus.checkout.application.stock.StockLedgerService;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.checkout.CheckoutSessionRepository;
import io.hhplus.checkout.domain.checkout.CheckoutSessionStatus;
import io.hhplus.checkout.domain.checkout.Reservation;
import io.hhplus.checkout.domain.checkout.ReservationRepository;
import io.hhplus.checkout.domain.checkout.ReservationStatus;
import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderCancelledEvent;
import io.hhplus.checkout.domain.order.OrderConfirmedEvent;
import io.hhplus.checkout.domain.order.OrderRepository;
import io.hhplus.checkout.infrastructure.redis.DistributedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문 상태 머신
 *
 * DRAFT → {CONFIRMED, CANCELLED}. 전이는 조건부 UPDATE 로만 일어나며,
 * 먼저 처리된 결제 결과(SUCCESS/FAILURE)가 최종 상태를 결정한다.
 *
 * 확정 순서 (하나의 짧은 트랜잭션):
 * 1. 세션의 예약이 모두 ACTIVE 인지 확인 (아니면 RESERVATION_INCONSISTENT, 아무것도 쓰지 않음)
 * 2. 예약마다 ACTIVE → CONFIRMED. 스위퍼에게 하나라도 뺏기면 잡은 예약을 ACTIVE 로 되돌리고 RESERVATION_INCONSISTENT
 * 3. 주문 DRAFT → CONFIRMED. 0행이면 동시에 도착한 실패 보고가 이긴 것이므로 잡은 예약을 해제하고 ALREADY_TERMINAL
 *    (1, 2 단계에서 예약이 비활성이어도 주문이 이미 종결되었다면 같은 이유로 ALREADY_TERMINAL)
 * 4. 원장 commit
 * 5. 세션 AWAITING_PAYMENT → COMPLETED
 * 6. OrderConfirmedEvent 발행 (커밋 후 Kafka 전달)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderTransitionService {

    private final OrderRepository orderRepository;
    private final ReservationRepository reservationRepository;
    private final CheckoutSessionRepository checkoutSessionRepository;
    private final StockLedgerService stockLedgerService;
    private final ApplicationEventPublisher eventPublisher;

    @DistributedLock(key = "'lock:payment-tx:' + #providerTransactionId")
    @Transactional
    public TransitionResult confirm(Long orderId, String providerTransactionId) {
        Order order = orderRepository.findByIdOrThrow(orderId);
        if (!order.isDraft()) {
            log.info("Order already terminal, confirm skipped: orderId={}, status={}", orderId, order.getStatus());
            return TransitionResult.ALREADY_TERMINAL;
        }

        List<Reservation> reservations = reservationRepository.findByCheckoutSessionId(order.getCheckoutSessionId());
        if (reservations.stream().anyMatch(r -> !r.isActive()) && !isStillDraft(orderId)) {
            log.info("Order resolved concurrently, confirm skipped: orderId={}", orderId);
            return TransitionResult.ALREADY_TERMINAL;
        }
        verifyAllActive(order, reservations);

        LocalDateTime now = LocalDateTime.now();
        List<Reservation> held = new ArrayList<>();
        for (Reservation reservation : reservations) {
            int updated = reservationRepository.transition(
                reservation.getId(), ReservationStatus.ACTIVE, ReservationStatus.CONFIRMED, now);
            if (updated == 0) {
                if (!isStillDraft(orderId)) {
                    releaseHeld(held, now);
                    log.info("Order resolved concurrently, confirm skipped: orderId={}", orderId);
                    return TransitionResult.ALREADY_TERMINAL;
                }
                restoreHeld(held, now);
                log.error("[ALERT] Reservation resolved concurrently during confirm: orderId={}, reservationId={}",
                    orderId, reservation.getId());
                throw new BusinessException(
                    ErrorCode.RESERVATION_INCONSISTENT,
                    "확정 중 예약이 다른 주체에 의해 정리되었습니다. reservationId: " + reservation.getId()
                );
            }
            held.add(reservation);
        }

        if (orderRepository.confirmIfDraft(orderId, now) == 0) {
            releaseHeld(held, now);
            log.info("Order already terminal, confirm skipped: orderId={}", orderId);
            return TransitionResult.ALREADY_TERMINAL;
        }

        for (Reservation reservation : held) {
            stockLedgerService.commit(reservation.getProductId(), reservation.getSize(), reservation.getQuantity());
        }

        int sessionUpdated = checkoutSessionRepository.transition(
            order.getCheckoutSessionId(), CheckoutSessionStatus.AWAITING_PAYMENT, CheckoutSessionStatus.COMPLETED, now);
        if (sessionUpdated == 0) {
            log.warn("Checkout session was not awaiting payment at confirm: sessionId={}", order.getCheckoutSessionId());
        }

        Order confirmed = orderRepository.findByIdOrThrow(orderId);
        eventPublisher.publishEvent(new OrderConfirmedEvent(
            confirmed.getId(),
            confirmed.getOrderNumber(),
            confirmed.getProviderTransactionId(),
            confirmed.getCheckoutSessionId(),
            confirmed.getTotalAmount(),
            confirmed.getCurrency(),
            confirmed.getPaidAt()
        ));

        log.info("Order confirmed: orderId={}, providerTransactionId={}, reservations={}",
            orderId, providerTransactionId, reservations.size());
        return TransitionResult.CONFIRMED;
    }

    /**
     * 결제 실패 보고. DRAFT 이면 취소하고 남은 예약을 돌려놓는다.
     */
    @DistributedLock(key = "'lock:payment-tx:' + #providerTransactionId")
    @Transactional
    public TransitionResult cancel(Long orderId, String providerTransactionId, String reportedState) {
        Order order = orderRepository.findByIdOrThrow(orderId);

        LocalDateTime now = LocalDateTime.now();
        if (orderRepository.cancelIfDraft(orderId, now) == 0) {
            log.info("Order already terminal, cancel skipped: orderId={}, status={}", orderId, order.getStatus());
            return TransitionResult.ALREADY_TERMINAL;
        }

        int released = 0;
        for (Reservation reservation : reservationRepository.findByCheckoutSessionId(order.getCheckoutSessionId())) {
            if (!reservation.isActive()) {
                continue;
            }
            int updated = reservationRepository.transition(
                reservation.getId(), ReservationStatus.ACTIVE, ReservationStatus.RELEASED, now);
            if (updated == 1) {
                stockLedgerService.release(reservation.getProductId(), reservation.getSize(), reservation.getQuantity());
                released++;
            }
        }

        checkoutSessionRepository.transition(
            order.getCheckoutSessionId(), CheckoutSessionStatus.AWAITING_PAYMENT, CheckoutSessionStatus.CANCELLED, now);

        eventPublisher.publishEvent(new OrderCancelledEvent(
            order.getId(),
            order.getOrderNumber(),
            order.getProviderTransactionId(),
            order.getCheckoutSessionId(),
            reportedState,
            now
        ));

        log.info("Order cancelled: orderId={}, providerTransactionId={}, reportedState={}, releasedReservations={}",
            orderId, providerTransactionId, reportedState, released);
        return TransitionResult.CANCELLED;
    }

    private boolean isStillDraft(Long orderId) {
        return orderRepository.findByIdOrThrow(orderId).isDraft();
    }

    private void restoreHeld(List<Reservation> held, LocalDateTime now) {
        for (Reservation reservation : held) {
            reservationRepository.transition(reservation.getId(), ReservationStatus.CONFIRMED, ReservationStatus.ACTIVE, now);
        }
    }

    /**
     * 실패 보고가 주문을 먼저 가져간 경우. 잡은 예약은 취소 경로가 보지 못하므로 여기서 돌려놓는다.
     */
    private void releaseHeld(List<Reservation> held, LocalDateTime now) {
        for (Reservation reservation : held) {
            int updated = reservationRepository.transition(
                reservation.getId(), ReservationStatus.CONFIRMED, ReservationStatus.RELEASED, now);
            if (updated == 1) {
                stockLedgerService.release(reservation.getProductId(), reservation.getSize(), reservation.getQuantity());
            }
        }
    }

    private void verifyAllActive(Order order, List<Reservation> reservations) {
        if (reservations.isEmpty()) {
            throw new BusinessException(
                ErrorCode.RESERVATION_INCONSISTENT,
                "확정할 예약이 없습니다. sessionId: " + order.getCheckoutSessionId()
            );
        }
        for (Reservation reservation : reservations) {
            if (!reservation.isActive()) {
                log.error("[ALERT] Reservation not active at confirm: orderId={}, reservationId={}, status={}",
                    order.getId(), reservation.getId(), reservation.getStatus());
                throw new BusinessException(
                    ErrorCode.RESERVATION_INCONSISTENT,
                    String.format("예약이 유효하지 않습니다. reservationId: %d, status: %s",
                        reservation.getId(), reservation.getStatus())
                );
            }
        }
    }
}
