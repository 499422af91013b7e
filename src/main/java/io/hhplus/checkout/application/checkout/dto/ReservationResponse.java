package io.hhplus.checkout.application.checkout.dto;

import io.hhplus.checkout.domain.checkout.Reservation;

import java.time.LocalDateTime;

public record ReservationResponse(
    Long reservationId,
    String productId,
    String size,
    int quantity,
    String status,
    LocalDateTime expiresAt
) {
    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
            reservation.getId(),
            reservation.getProductId(),
            reservation.getSize(),
            reservation.getQuantity(),
            reservation.getStatus().name(),
            reservation.getExpiresAt()
        );
    }
}
