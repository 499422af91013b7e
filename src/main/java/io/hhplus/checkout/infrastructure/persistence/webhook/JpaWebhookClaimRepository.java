package io.hhplus.checkout.infrastructure.persistence.webhook;

import io.hhplus.checkout.domain.webhook.ClaimStatus;
import io.hhplus.checkout.domain.webhook.WebhookClaim;
import io.hhplus.checkout.domain.webhook.WebhookClaimRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 웹훅 선점 JPA Repository
 *
 * saveAndFlush 는 호출자의 트랜잭션 밖에서 실행된다.
 * UNIQUE 위반이 바깥 트랜잭션을 rollback-only 로 만들지 않도록 하기 위함.
 */
@Repository
@Primary
public interface JpaWebhookClaimRepository extends JpaRepository<WebhookClaim, Long>, WebhookClaimRepository {

    @Override
    WebhookClaim saveAndFlush(WebhookClaim claim);

    @Override
    Optional<WebhookClaim> findByDedupKey(String dedupKey);

    @Override
    default int reclaim(String dedupKey, String claimedBy, Long rawWebhookId,
                        LocalDateTime now, LocalDateTime staleBefore) {
        return reclaimClaim(dedupKey, claimedBy, rawWebhookId, now, staleBefore,
                ClaimStatus.FAILED, ClaimStatus.PROCESSING);
    }

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE WebhookClaim c SET c.status = :processing, c.claimedBy = :claimedBy, " +
           "c.rawWebhookId = :rawWebhookId, c.claimedAt = :now, c.attempts = c.attempts + 1, c.completedAt = null " +
           "WHERE c.dedupKey = :dedupKey " +
           "AND (c.status = :failed OR (c.status = :processing AND c.claimedAt < :staleBefore))")
    int reclaimClaim(@Param("dedupKey") String dedupKey,
                     @Param("claimedBy") String claimedBy,
                     @Param("rawWebhookId") Long rawWebhookId,
                     @Param("now") LocalDateTime now,
                     @Param("staleBefore") LocalDateTime staleBefore,
                     @Param("failed") ClaimStatus failed,
                     @Param("processing") ClaimStatus processing);

    @Override
    default int finish(String dedupKey, String claimedBy, ClaimStatus to, String result, LocalDateTime now) {
        return finishClaim(dedupKey, claimedBy, to, result, now, ClaimStatus.PROCESSING);
    }

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE WebhookClaim c SET c.status = :to, c.result = :result, c.completedAt = :now " +
           "WHERE c.dedupKey = :dedupKey AND c.claimedBy = :claimedBy AND c.status = :processing")
    int finishClaim(@Param("dedupKey") String dedupKey,
                    @Param("claimedBy") String claimedBy,
                    @Param("to") ClaimStatus to,
                    @Param("result") String result,
                    @Param("now") LocalDateTime now,
                    @Param("processing") ClaimStatus processing);

    @Override
    long countByStatus(ClaimStatus status);
}
