package io.hhplus.checkout.infrastructure.persistence.webhook;

import io.hhplus.checkout.domain.webhook.ClaimStatus;
import io.hhplus.checkout.domain.webhook.WebhookClaim;
import io.hhplus.checkout.domain.webhook.WebhookClaimRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * dedupKey UNIQUE 제약을 putIfAbsent 로 흉내낸다.
 */
@Repository
@Profile("inmemory")
public class InMemoryWebhookClaimRepository implements WebhookClaimRepository {

    private final Map<String, WebhookClaim> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public WebhookClaim saveAndFlush(WebhookClaim claim) {
        if (claim.getId() != null) {
            storage.put(claim.getDedupKey(), claim);
            return claim;
        }
        WebhookClaim existing = storage.putIfAbsent(claim.getDedupKey(), claim);
        if (existing != null) {
            throw new DataIntegrityViolationException("Duplicate entry for key 'uk_webhook_claim_dedup': " + claim.getDedupKey());
        }
        try {
            var idField = WebhookClaim.class.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(claim, idGenerator.getAndIncrement());
        } catch (Exception e) {
            throw new RuntimeException("Failed to set ID", e);
        }
        return claim;
    }

    @Override
    public Optional<WebhookClaim> findByDedupKey(String dedupKey) {
        return Optional.ofNullable(storage.get(dedupKey));
    }

    @Override
    public int reclaim(String dedupKey, String claimedBy, Long rawWebhookId,
                       LocalDateTime now, LocalDateTime staleBefore) {
        int[] updated = {0};
        storage.computeIfPresent(dedupKey, (k, claim) -> {
            if (claim.reclaim(claimedBy, rawWebhookId, now, staleBefore)) {
                updated[0] = 1;
            }
            return claim;
        });
        return updated[0];
    }

    @Override
    public int finish(String dedupKey, String claimedBy, ClaimStatus to, String result, LocalDateTime now) {
        int[] updated = {0};
        storage.computeIfPresent(dedupKey, (k, claim) -> {
            if (claim.finish(claimedBy, to, result, now)) {
                updated[0] = 1;
            }
            return claim;
        });
        return updated[0];
    }

    @Override
    public long countByStatus(ClaimStatus status) {
        return storage.values().stream().filter(c -> c.getStatus() == status).count();
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
