package io.hhplus.checkout.infrastructure.persistence.order;

import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@Profile("inmemory")
public class InMemoryOrderRepository implements OrderRepository {

    private final Map<Long, Order> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public Optional<Order> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public Optional<Order> findByOrderNumber(String orderNumber) {
        return storage.values().stream()
                .filter(order -> order.getOrderNumber().equals(orderNumber))
                .findFirst();
    }

    @Override
    public Optional<Order> findByProviderTransactionId(String providerTransactionId) {
        return storage.values().stream()
                .filter(order -> order.getProviderTransactionId().equals(providerTransactionId))
                .findFirst();
    }

    @Override
    public List<Order> findAll() {
        return new ArrayList<>(storage.values());
    }

    @Override
    public synchronized Order save(Order order) {
        if (order.getId() == null) {
            if (findByProviderTransactionId(order.getProviderTransactionId()).isPresent()) {
                throw new DataIntegrityViolationException(
                    "Duplicate provider transaction id: " + order.getProviderTransactionId());
            }
            try {
                var idField = Order.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(order, idGenerator.getAndIncrement());
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }
        storage.put(order.getId(), order);
        return order;
    }

    @Override
    public synchronized int confirmIfDraft(Long orderId, LocalDateTime now) {
        Order order = storage.get(orderId);
        if (order == null || !order.isDraft()) {
            return 0;
        }
        order.confirm(now);
        return 1;
    }

    @Override
    public synchronized int cancelIfDraft(Long orderId, LocalDateTime now) {
        Order order = storage.get(orderId);
        if (order == null || !order.isDraft()) {
            return 0;
        }
        order.cancel(now);
        return 1;
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
