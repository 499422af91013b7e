package io.hhplus.checkout.infrastructure.persistence.checkout;

import io.hhplus.checkout.domain.checkout.CheckoutSession;
import io.hhplus.checkout.domain.checkout.CheckoutSessionRepository;
import io.hhplus.checkout.domain.checkout.CheckoutSessionStatus;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@Profile("inmemory")
public class InMemoryCheckoutSessionRepository implements CheckoutSessionRepository {

    private final Map<String, CheckoutSession> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public Optional<CheckoutSession> findBySessionId(String sessionId) {
        return Optional.ofNullable(storage.get(sessionId));
    }

    @Override
    public CheckoutSession save(CheckoutSession session) {
        if (session.getId() == null) {
            try {
                var idField = CheckoutSession.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(session, idGenerator.getAndIncrement());
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }
        storage.put(session.getSessionId(), session);
        return session;
    }

    @Override
    public synchronized int transition(String sessionId, CheckoutSessionStatus from,
                                       CheckoutSessionStatus to, LocalDateTime now) {
        CheckoutSession session = storage.get(sessionId);
        if (session == null) {
            return 0;
        }
        return session.transition(from, to, now) ? 1 : 0;
    }

    @Override
    public synchronized int expireOpenSessions(LocalDateTime now) {
        int updated = 0;
        for (CheckoutSession session : storage.values()) {
            if (session.isOpen() && session.isExpiredAt(now)
                && session.transition(session.getStatus(), CheckoutSessionStatus.EXPIRED, now)) {
                updated++;
            }
        }
        return updated;
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
