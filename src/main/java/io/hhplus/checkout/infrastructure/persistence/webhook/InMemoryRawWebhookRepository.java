package io.hhplus.checkout.infrastructure.persistence.webhook;

import io.hhplus.checkout.domain.webhook.RawWebhook;
import io.hhplus.checkout.domain.webhook.RawWebhookRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@Profile("inmemory")
public class InMemoryRawWebhookRepository implements RawWebhookRepository {

    private final Map<Long, RawWebhook> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public RawWebhook save(RawWebhook rawWebhook) {
        if (rawWebhook.getId() == null) {
            try {
                var idField = RawWebhook.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(rawWebhook, idGenerator.getAndIncrement());
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }
        storage.put(rawWebhook.getId(), rawWebhook);
        return rawWebhook;
    }

    @Override
    public Optional<RawWebhook> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<RawWebhook> findByProviderTransactionId(String providerTransactionId) {
        return storage.values().stream()
                .filter(w -> Objects.equals(w.getProviderTransactionId(), providerTransactionId))
                .sorted(Comparator.comparing(RawWebhook::getId))
                .toList();
    }

    @Override
    public List<RawWebhook> findByDedupKey(String dedupKey) {
        return storage.values().stream()
                .filter(w -> Objects.equals(w.getDedupKey(), dedupKey))
                .sorted(Comparator.comparing(RawWebhook::getId))
                .toList();
    }

    public List<RawWebhook> findAll() {
        return storage.values().stream()
                .sorted(Comparator.comparing(RawWebhook::getId))
                .toList();
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
