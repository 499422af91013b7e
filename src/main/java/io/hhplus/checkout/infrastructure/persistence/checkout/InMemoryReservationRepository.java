package io.hhplus.checkout.infrastructure.persistence.checkout;

import io.hhplus.checkout.domain.checkout.Reservation;
import io.hhplus.checkout.domain.checkout.ReservationRepository;
import io.hhplus.checkout.domain.checkout.ReservationStatus;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@Profile("inmemory")
public class InMemoryReservationRepository implements ReservationRepository {

    private final Map<Long, Reservation> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public Reservation save(Reservation reservation) {
        if (reservation.getId() == null) {
            try {
                var idField = Reservation.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(reservation, idGenerator.getAndIncrement());
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }
        storage.put(reservation.getId(), reservation);
        return reservation;
    }

    @Override
    public Optional<Reservation> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<Reservation> findByCheckoutSessionId(String checkoutSessionId) {
        return storage.values().stream()
                .filter(r -> r.getCheckoutSessionId().equals(checkoutSessionId))
                .sorted(Comparator.comparing(Reservation::getId))
                .toList();
    }

    @Override
    public List<Reservation> findExpiredActive(LocalDateTime now, int limit) {
        return storage.values().stream()
                .filter(r -> r.isActive() && r.isExpiredAt(now))
                .sorted(Comparator.comparing(Reservation::getExpiresAt))
                .limit(limit)
                .toList();
    }

    @Override
    public int transition(Long id, ReservationStatus from, ReservationStatus to, LocalDateTime now) {
        int[] updated = {0};
        storage.computeIfPresent(id, (k, reservation) -> {
            if (reservation.transition(from, to, now)) {
                updated[0] = 1;
            }
            return reservation;
        });
        return updated[0];
    }

    @Override
    public long countByStatus(ReservationStatus status) {
        return storage.values().stream().filter(r -> r.getStatus() == status).count();
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
