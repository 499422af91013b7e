package io.hhplus.checkout.infrastructure.redis;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * 분산락 어노테이션
 *
 * SpEL 표현식으로 락 키를 만든다.
 * <pre>
 * {@code
 * @DistributedLock(key = "'lock:payment-tx:' + #providerTransactionId")
 * public TransitionResult confirm(Long orderId, String providerTransactionId) { ... }
 * }
 * </pre>
 *
 * 주의사항:
 * - 정합성은 조건부 UPDATE가 보장한다. 락은 같은 거래의 동시 처리를 줄이는 용도다.
 * - Redis 장애 또는 RedissonClient 미등록 시 락 없이 진행한다 (fail-open).
 * - 락 → 트랜잭션 → 커밋 → 락 해제 순서를 지킨다.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    /**
     * 락 키 (SpEL 표현식)
     */
    String key();

    /**
     * 락 획득 대기 시간. 넘기면 락 없이 진행한다.
     */
    long waitTime() default 3L;

    /**
     * 락 임대 시간
     */
    long leaseTime() default 10L;

    TimeUnit timeUnit() default TimeUnit.SECONDS;
}
