package io.hhplus.checkout.application.checkout.dto;

import io.hhplus.checkout.domain.checkout.CheckoutSession;
import io.hhplus.checkout.domain.checkout.Reservation;

import java.time.LocalDateTime;
import java.util.List;

public record CheckoutSessionResponse(
    String sessionId,
    String status,
    boolean stockReserved,
    Long totalAmount,
    LocalDateTime expiresAt,
    List<ReservationResponse> reservations
) {
    public static CheckoutSessionResponse of(CheckoutSession session, List<Reservation> reservations) {
        return new CheckoutSessionResponse(
            session.getSessionId(),
            session.getStatus().name(),
            session.isStockReserved(),
            session.getTotalAmount(),
            session.getExpiresAt(),
            reservations.stream().map(ReservationResponse::from).toList()
        );
    }
}
