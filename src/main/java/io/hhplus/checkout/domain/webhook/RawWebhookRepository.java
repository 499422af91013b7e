package io.hhplus.checkout.domain.webhook;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;

import java.util.List;
import java.util.Optional;

public interface RawWebhookRepository {

    RawWebhook save(RawWebhook rawWebhook);

    Optional<RawWebhook> findById(Long id);

    List<RawWebhook> findByProviderTransactionId(String providerTransactionId);

    List<RawWebhook> findByDedupKey(String dedupKey);

    default RawWebhook findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.INVALID_INPUT,
                "웹훅 기록을 찾을 수 없습니다. rawWebhookId: " + id
            ));
    }
}
