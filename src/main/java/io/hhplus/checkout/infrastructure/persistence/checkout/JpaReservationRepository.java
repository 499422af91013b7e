package io.hhplus.checkout.infrastructure.persistence.checkout;

import io.hhplus.checkout.domain.checkout.Reservation;
import io.hhplus.checkout.domain.checkout.ReservationRepository;
import io.hhplus.checkout.domain.checkout.ReservationStatus;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaReservationRepository extends JpaRepository<Reservation, Long>, ReservationRepository {

    @Override
    Reservation save(Reservation reservation);

    @Override
    Optional<Reservation> findById(Long id);

    @Override
    @Query("SELECT r FROM Reservation r WHERE r.checkoutSessionId = :checkoutSessionId ORDER BY r.id ASC")
    List<Reservation> findByCheckoutSessionId(@Param("checkoutSessionId") String checkoutSessionId);

    @Override
    default List<Reservation> findExpiredActive(LocalDateTime now, int limit) {
        return findByStatusAndExpiresAtBefore(ReservationStatus.ACTIVE, now, PageRequest.of(0, limit));
    }

    @Query("SELECT r FROM Reservation r " +
           "WHERE r.status = :status AND r.expiresAt < :now " +
           "ORDER BY r.expiresAt ASC")
    List<Reservation> findByStatusAndExpiresAtBefore(@Param("status") ReservationStatus status,
                                                     @Param("now") LocalDateTime now,
                                                     Pageable pageable);

    @Override
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Reservation r SET r.status = :to, r.resolvedAt = :now " +
           "WHERE r.id = :id AND r.status = :from")
    int transition(@Param("id") Long id,
                   @Param("from") ReservationStatus from,
                   @Param("to") ReservationStatus to,
                   @Param("now") LocalDateTime now);

    @Override
    long countByStatus(ReservationStatus status);
}
