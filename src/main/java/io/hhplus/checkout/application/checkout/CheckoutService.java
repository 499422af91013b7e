package io.hhplus.checkout.application.checkout;

import io.hhplus.checkout.application.checkout.dto.CheckoutItemRequest;
import io.hhplus.checkout.application.checkout.dto.CheckoutSessionResponse;
import io.hhplus.checkout.application.checkout.dto.StartCheckoutRequest;
import io.hhplus.checkout.application.checkout.dto.StartCheckoutResponse;
import io.hhplus.checkout.application.order.OrderTransitionService;
import io.hhplus.checkout.application.order.TransitionResult;
import io.hhplus.checkout.application.stock.StockLedgerService;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.config.CheckoutProperties;
import io.hhplus.checkout.domain.checkout.CheckoutSession;
import io.hhplus.checkout.domain.checkout.CheckoutSessionRepository;
import io.hhplus.checkout.domain.checkout.CheckoutSessionStatus;
import io.hhplus.checkout.domain.checkout.Reservation;
import io.hhplus.checkout.domain.checkout.ReservationRepository;
import io.hhplus.checkout.domain.checkout.ReservationStatus;
import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderItem;
import io.hhplus.checkout.domain.order.OrderRepository;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * 체크아웃 세션 / 재고 예약 관리
 *
 * 세션 전체를 하나의 트랜잭션으로 묶지 않는다.
 * 라인마다 원장 reserve 를 호출하고, 중간에 실패하면 이미 잡은 라인을 되돌린다 (보상).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutService {

    private static final DateTimeFormatter ORDER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final CheckoutSessionRepository checkoutSessionRepository;
    private final ReservationRepository reservationRepository;
    private final OrderRepository orderRepository;
    private final StockLedgerService stockLedgerService;
    private final ReservationReleaser reservationReleaser;
    private final OrderTransitionService orderTransitionService;
    private final CheckoutProperties checkoutProperties;
    private final MetricsCollector metricsCollector;

    /**
     * 세션 생성 후 라인별 재고 예약
     *
     * @throws BusinessException INSUFFICIENT_STOCK (보상 완료 후), STOCK_ENTRY_NOT_FOUND
     */
    public CheckoutSessionResponse reserve(String sessionId, String userEmail, List<CheckoutItemRequest> items) {
        List<CheckoutItemRequest> lines = mergeLines(items);
        long totalAmount = lines.stream().mapToLong(CheckoutItemRequest::subtotal).sum();
        LocalDateTime expiresAt = LocalDateTime.now().plus(checkoutProperties.getReservation().getTtl());

        CheckoutSession session = checkoutSessionRepository.save(
            CheckoutSession.create(sessionId, userEmail, totalAmount, expiresAt)
        );

        List<Reservation> granted = new ArrayList<>();
        for (CheckoutItemRequest line : lines) {
            try {
                stockLedgerService.reserve(line.productId(), line.size(), line.quantity());
            } catch (RuntimeException e) {
                compensate(sessionId, granted, e);
                metricsCollector.recordReservationFailure();
                log.warn("Checkout reservation failed, compensated: sessionId={}, productId={}, size={}, quantity={}, reason={}",
                    sessionId, line.productId(), line.size(), line.quantity(), e.getMessage());
                throw e;
            }

            try {
                granted.add(reservationRepository.save(
                    Reservation.create(sessionId, line.productId(), line.size(), line.quantity(), expiresAt)
                ));
            } catch (RuntimeException e) {
                stockLedgerService.release(line.productId(), line.size(), line.quantity());
                compensate(sessionId, granted, e);
                metricsCollector.recordReservationFailure();
                log.error("Reservation record could not be saved, compensated: sessionId={}", sessionId, e);
                throw e;
            }
        }

        session.markAwaitingPayment();
        CheckoutSession saved = checkoutSessionRepository.save(session);
        metricsCollector.recordReservationSuccess();

        log.info("Checkout reserved: sessionId={}, lines={}, totalAmount={}, expiresAt={}",
            sessionId, granted.size(), totalAmount, expiresAt);
        return CheckoutSessionResponse.of(saved, granted);
    }

    /**
     * 예약 + DRAFT 주문 생성. 스토어프론트는 반환된 거래 ID로 결제를 시작한다.
     */
    public StartCheckoutResponse startCheckout(StartCheckoutRequest request) {
        String sessionId = "CS-" + UUID.randomUUID();
        CheckoutSessionResponse session = reserve(sessionId, request.userEmail(), request.items());

        Order order;
        try {
            order = Order.createDraft(
                generateOrderNumber(),
                generateProviderTransactionId(),
                sessionId,
                request.currency()
            );
            for (CheckoutItemRequest line : mergeLines(request.items())) {
                OrderItem.create(order, line.productId(), line.size(), line.quantity(), line.unitPrice());
            }
            order = orderRepository.save(order);
        } catch (RuntimeException e) {
            log.error("Draft order could not be created, releasing session: sessionId={}", sessionId, e);
            release(sessionId);
            throw e;
        }

        log.info("Checkout started: sessionId={}, orderId={}, providerTransactionId={}, totalAmount={}",
            sessionId, order.getId(), order.getProviderTransactionId(), order.getTotalAmount());

        return new StartCheckoutResponse(
            sessionId,
            order.getId(),
            order.getOrderNumber(),
            order.getProviderTransactionId(),
            order.getTotalAmount(),
            order.getCurrency(),
            session.expiresAt()
        );
    }

    /**
     * 쇼핑객 해제. ACTIVE 예약만 돌려놓으며 여러 번 호출해도 결과가 같다.
     */
    public CheckoutSessionResponse release(String sessionId) {
        CheckoutSession session = checkoutSessionRepository.findBySessionIdOrThrow(sessionId);
        LocalDateTime now = LocalDateTime.now();

        int released = releaseActive(reservationRepository.findByCheckoutSessionId(sessionId), now);
        if (session.getStatus().isOpen()) {
            checkoutSessionRepository.transition(sessionId, session.getStatus(), CheckoutSessionStatus.CANCELLED, now);
        }

        log.info("Checkout released: sessionId={}, releasedReservations={}", sessionId, released);
        return CheckoutSessionResponse.of(
            checkoutSessionRepository.findBySessionIdOrThrow(sessionId),
            reservationRepository.findByCheckoutSessionId(sessionId)
        );
    }

    /**
     * 운영자/재처리 경로의 수동 확정
     */
    public TransitionResult confirm(Long orderId) {
        Order order = orderRepository.findByIdOrThrow(orderId);
        return orderTransitionService.confirm(order.getId(), order.getProviderTransactionId());
    }

    public CheckoutSessionResponse getSession(String sessionId) {
        return CheckoutSessionResponse.of(
            checkoutSessionRepository.findBySessionIdOrThrow(sessionId),
            reservationRepository.findByCheckoutSessionId(sessionId)
        );
    }

    /**
     * 이미 잡은 라인을 되돌린다. 되돌리기 실패는 원래 예외에 붙이고, 해당 예약은 ACTIVE 로 남아 만료 회수 대상이 된다.
     */
    private void compensate(String sessionId, List<Reservation> granted, RuntimeException cause) {
        LocalDateTime now = LocalDateTime.now();
        for (Reservation reservation : granted) {
            try {
                reservationReleaser.releaseIfActive(reservation, ReservationStatus.RELEASED, now);
            } catch (RuntimeException e) {
                log.error("Compensation release failed, left for sweeper: sessionId={}, reservationId={}",
                    sessionId, reservation.getId(), e);
                cause.addSuppressed(e);
            }
        }
        checkoutSessionRepository.transition(sessionId, CheckoutSessionStatus.PENDING, CheckoutSessionStatus.CANCELLED, now);
    }

    private int releaseActive(List<Reservation> reservations, LocalDateTime now) {
        int released = 0;
        for (Reservation reservation : reservations) {
            if (reservationReleaser.releaseIfActive(reservation, ReservationStatus.RELEASED, now)) {
                released++;
            }
        }
        return released;
    }

    /**
     * 같은 상품+사이즈 라인은 합친다 (단가는 먼저 나온 라인 기준)
     */
    private List<CheckoutItemRequest> mergeLines(List<CheckoutItemRequest> items) {
        if (items == null || items.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "주문 상품은 최소 1개 이상이어야 합니다");
        }

        Map<String, CheckoutItemRequest> merged = new LinkedHashMap<>();
        for (CheckoutItemRequest item : items) {
            if (item.productId() == null || item.productId().isBlank() || item.size() == null || item.size().isBlank()) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "상품 ID와 사이즈는 필수입니다");
            }
            if (item.quantity() == null || item.quantity() <= 0) {
                throw new BusinessException(ErrorCode.INVALID_QUANTITY);
            }
            if (item.unitPrice() == null || item.unitPrice() <= 0) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "단가는 0보다 커야 합니다");
            }
            String key = item.productId() + "::" + item.size().toUpperCase(Locale.ROOT);
            merged.merge(key, normalize(item), (existing, added) -> new CheckoutItemRequest(
                existing.productId(), existing.size(), existing.quantity() + added.quantity(), existing.unitPrice()
            ));
        }
        return new ArrayList<>(merged.values());
    }

    private CheckoutItemRequest normalize(CheckoutItemRequest item) {
        return new CheckoutItemRequest(
            item.productId(), item.size().toUpperCase(Locale.ROOT), item.quantity(), item.unitPrice()
        );
    }

    private String generateOrderNumber() {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 6).toUpperCase(Locale.ROOT);
        return "ORD-" + LocalDate.now().format(ORDER_DATE) + "-" + random;
    }

    private String generateProviderTransactionId() {
        return "TXN-" + UUID.randomUUID().toString().replace("-", "").toUpperCase(Locale.ROOT);
    }
}
