package io.hhplus.checkout.application.webhook;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.config.PaymentWebhookProperties;
import io.hhplus.checkout.domain.webhook.ClaimStatus;
import io.hhplus.checkout.domain.webhook.RawWebhook;
import io.hhplus.checkout.domain.webhook.RawWebhookRepository;
import io.hhplus.checkout.domain.webhook.WebhookClaim;
import io.hhplus.checkout.domain.webhook.WebhookClaimRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * 웹훅 원문 기록과 처리 선점(claim)
 * <p>
 * Insert-first 전략:
 * - dedupKey UNIQUE 제약으로 PROCESSING claim INSERT를 먼저 시도한다. 성공한 1건이 처리한다.
 * - 중복이면 FAILED 또는 오래된 PROCESSING 만 조건부 UPDATE 로 재선점한다.
 * - 그 외에는 진 것이며 기존 claim 의 결과를 돌려받는다.
 * <p>
 * 호출자의 트랜잭션 안에서 부르지 않는다. UNIQUE 위반이 바깥 트랜잭션을 rollback-only 로 만든다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookStoreService {

    private final RawWebhookRepository rawWebhookRepository;
    private final WebhookClaimRepository webhookClaimRepository;
    private final PaymentWebhookProperties properties;

    /**
     * 비즈니스 로직 전에 무조건 저장한다 (위조 요청 포함)
     */
    public RawWebhook record(WebhookCommand command) {
        RawWebhook rawWebhook = RawWebhook.receive(
            command.provider(),
            command.rawPayload(),
            command.signature(),
            command.keyIndex(),
            command.correlationId(),
            LocalDateTime.now()
        );
        RawWebhook saved = rawWebhookRepository.save(rawWebhook);
        log.debug("Webhook recorded: rawWebhookId={}, provider={}, correlationId={}",
            saved.getId(), saved.getProvider(), saved.getCorrelationId());
        return saved;
    }

    public RawWebhook save(RawWebhook rawWebhook) {
        return rawWebhookRepository.save(rawWebhook);
    }

    public RawWebhook findById(Long rawWebhookId) {
        return rawWebhookRepository.findByIdOrThrow(rawWebhookId);
    }

    public ClaimResult claim(String dedupKey, Long rawWebhookId) {
        String claimedBy = properties.getWorkerId() + ":" + rawWebhookId;
        LocalDateTime now = LocalDateTime.now();

        try {
            WebhookClaim claim = webhookClaimRepository.saveAndFlush(
                WebhookClaim.start(dedupKey, claimedBy, rawWebhookId, now)
            );
            log.debug("Claim acquired: dedupKey={}, claimedBy={}", dedupKey, claimedBy);
            return ClaimResult.won(claim, claimedBy);
        } catch (DataIntegrityViolationException e) {
            LocalDateTime staleBefore = now.minus(properties.getStaleClaimTimeout());
            int reclaimed = webhookClaimRepository.reclaim(dedupKey, claimedBy, rawWebhookId, now, staleBefore);

            WebhookClaim existing = webhookClaimRepository.findByDedupKey(dedupKey)
                .orElseThrow(() -> new BusinessException(
                    ErrorCode.INTERNAL_SERVER_ERROR,
                    "claim 을 찾을 수 없습니다: " + dedupKey
                ));

            if (reclaimed == 1) {
                log.info("Claim re-acquired: dedupKey={}, claimedBy={}, attempts={}",
                    dedupKey, claimedBy, existing.getAttempts());
                return ClaimResult.won(existing, claimedBy);
            }

            log.debug("Claim lost: dedupKey={}, owner={}, status={}",
                dedupKey, existing.getClaimedBy(), existing.getStatus());
            return ClaimResult.lost(existing, claimedBy);
        }
    }

    public void complete(ClaimResult claim, String result) {
        finish(claim, ClaimStatus.COMPLETED, result);
    }

    /**
     * 일시 장애. 재처리가 다시 선점할 수 있다.
     */
    public void fail(ClaimResult claim, ErrorCode errorCode) {
        finish(claim, ClaimStatus.FAILED, errorCode.getCode());
    }

    /**
     * 운영자 확인 대기. 자동으로 재선점되지 않는다.
     */
    public void park(ClaimResult claim, ErrorCode errorCode) {
        finish(claim, ClaimStatus.MANUAL_REVIEW, errorCode.getCode());
    }

    private void finish(ClaimResult claim, ClaimStatus to, String result) {
        int updated = webhookClaimRepository.finish(claim.dedupKey(), claim.claimedBy(), to, result, LocalDateTime.now());
        if (updated == 0) {
            // stale 타임아웃으로 다른 워커가 재선점한 경우
            log.warn("Claim no longer owned, finish skipped: dedupKey={}, claimedBy={}, to={}",
                claim.dedupKey(), claim.claimedBy(), to);
        }
    }
}
