package io.hhplus.checkout.infrastructure.redis;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

/**
 * 분산락 AOP
 *
 * 동작 흐름:
 * 1. SpEL 표현식을 파싱하여 락 키 생성
 * 2. Redisson RLock 획득 시도 (대기 시간 내 실패 시 경고 후 락 없이 진행)
 * 3. 비즈니스 로직 실행
 * 4. finally 블록에서 락 해제 (현재 스레드가 보유한 경우만)
 *
 * 트랜잭션보다 바깥에서 감싸야 하므로 가장 높은 우선순위로 실행된다.
 */
@Slf4j
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class DistributedLockAspect {

    private final ObjectProvider<RedissonClient> redissonClientProvider;
    private final ExpressionParser parser = new SpelExpressionParser();

    public DistributedLockAspect(ObjectProvider<RedissonClient> redissonClientProvider) {
        this.redissonClientProvider = redissonClientProvider;
    }

    @Around("@annotation(io.hhplus.checkout.infrastructure.redis.DistributedLock)")
    public Object lock(ProceedingJoinPoint joinPoint) throws Throwable {
        RedissonClient redissonClient = redissonClientProvider.getIfAvailable();
        if (redissonClient == null) {
            return joinPoint.proceed();
        }

        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        DistributedLock distributedLock = method.getAnnotation(DistributedLock.class);

        String lockKey = parseLockKey(distributedLock.key(), signature, joinPoint.getArgs());

        RLock lock;
        boolean isLocked;
        try {
            lock = redissonClient.getLock(lockKey);
            isLocked = lock.tryLock(
                distributedLock.waitTime(),
                distributedLock.leaseTime(),
                distributedLock.timeUnit()
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("락 대기 중 인터럽트 발생: " + lockKey, e);
        } catch (RuntimeException e) {
            log.warn("Redis 락 사용 불가, 락 없이 진행: key={}, error={}", lockKey, e.getMessage());
            return joinPoint.proceed();
        }

        if (!isLocked) {
            log.warn("락 획득 실패, 락 없이 진행: key={}, waitTime={}{}",
                lockKey, distributedLock.waitTime(), distributedLock.timeUnit());
            return joinPoint.proceed();
        }

        log.debug("락 획득 성공: key={}", lockKey);
        try {
            return joinPoint.proceed();
        } finally {
            releaseQuietly(lock, lockKey);
        }
    }

    private void releaseQuietly(RLock lock, String lockKey) {
        try {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("락 해제: key={}", lockKey);
            }
        } catch (RuntimeException e) {
            // leaseTime 만료로 자동 해제된 경우
            log.warn("락 해제 실패: key={}, error={}", lockKey, e.getMessage());
        }
    }

    /**
     * 메서드 파라미터를 SpEL Context에 등록하고 표현식을 평가한다.
     * - "'lock:payment-tx:' + #providerTransactionId" → "lock:payment-tx:TXN-123"
     */
    private String parseLockKey(String keyExpression, MethodSignature signature, Object[] args) {
        StandardEvaluationContext context = new StandardEvaluationContext();

        String[] parameterNames = signature.getParameterNames();
        for (int i = 0; i < parameterNames.length; i++) {
            context.setVariable(parameterNames[i], args[i]);
        }

        return parser.parseExpression(keyExpression).getValue(context, String.class);
    }
}
