package io.hhplus.checkout.infrastructure.persistence.webhook;

import io.hhplus.checkout.domain.webhook.RawWebhook;
import io.hhplus.checkout.domain.webhook.RawWebhookRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaRawWebhookRepository extends JpaRepository<RawWebhook, Long>, RawWebhookRepository {

    @Override
    RawWebhook save(RawWebhook rawWebhook);

    @Override
    Optional<RawWebhook> findById(Long id);

    @Override
    List<RawWebhook> findByProviderTransactionId(String providerTransactionId);

    @Override
    List<RawWebhook> findByDedupKey(String dedupKey);
}
