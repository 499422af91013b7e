package io.hhplus.checkout.infrastructure.persistence.checkout;

import io.hhplus.checkout.domain.checkout.CheckoutSession;
import io.hhplus.checkout.domain.checkout.CheckoutSessionRepository;
import io.hhplus.checkout.domain.checkout.CheckoutSessionStatus;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

@Repository
@Primary
public interface JpaCheckoutSessionRepository extends JpaRepository<CheckoutSession, Long>, CheckoutSessionRepository {

    @Override
    CheckoutSession save(CheckoutSession session);

    @Override
    Optional<CheckoutSession> findBySessionId(String sessionId);

    @Override
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CheckoutSession s SET s.status = :to, s.stockReserved = false, s.closedAt = :now " +
           "WHERE s.sessionId = :sessionId AND s.status = :from")
    int transition(@Param("sessionId") String sessionId,
                   @Param("from") CheckoutSessionStatus from,
                   @Param("to") CheckoutSessionStatus to,
                   @Param("now") LocalDateTime now);

    @Override
    default int expireOpenSessions(LocalDateTime now) {
        return expireSessions(CheckoutSessionStatus.openStatuses(), CheckoutSessionStatus.EXPIRED, now);
    }

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CheckoutSession s SET s.status = :expired, s.stockReserved = false, s.closedAt = :now " +
           "WHERE s.status IN :openStatuses AND s.expiresAt < :now")
    int expireSessions(@Param("openStatuses") Collection<CheckoutSessionStatus> openStatuses,
                       @Param("expired") CheckoutSessionStatus expired,
                       @Param("now") LocalDateTime now);
}
