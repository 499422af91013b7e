package io.hhplus.checkout.infrastructure.redis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * 분산 락은 보조 수단: Redis 가 없거나 락을 못 잡아도 본 로직은 실행된다.
 */
@ExtendWith(MockitoExtension.class)
class DistributedLockAspectTest {

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock lock;

    private StaticListableBeanFactory beanFactory;

    @BeforeEach
    void setUp() {
        beanFactory = new StaticListableBeanFactory();
    }

    @Test
    @DisplayName("SpEL 키로 락을 잡고 실행 후 해제")
    void lock_획득() throws InterruptedException {
        // Given
        beanFactory.addBean("redissonClient", redissonClient);
        given(redissonClient.getLock("lock:payment-tx:TXN-1")).willReturn(lock);
        given(lock.tryLock(3L, 10L, TimeUnit.SECONDS)).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);

        // When
        String result = proxy().confirm(1L, "TXN-1");

        // Then
        assertThat(result).isEqualTo("confirmed:1");
        verify(lock).unlock();
    }

    @Test
    @DisplayName("락 대기 시간 초과 시 락 없이 진행")
    void lock_획득실패() throws InterruptedException {
        // Given
        beanFactory.addBean("redissonClient", redissonClient);
        given(redissonClient.getLock(anyString())).willReturn(lock);
        given(lock.tryLock(3L, 10L, TimeUnit.SECONDS)).willReturn(false);

        // When
        String result = proxy().confirm(2L, "TXN-2");

        // Then
        assertThat(result).isEqualTo("confirmed:2");
        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("Redis 장애 시 락 없이 진행")
    void lock_redis장애() {
        // Given
        beanFactory.addBean("redissonClient", redissonClient);
        given(redissonClient.getLock(anyString())).willThrow(new IllegalStateException("connection refused"));

        // When
        String result = proxy().confirm(3L, "TXN-3");

        // Then
        assertThat(result).isEqualTo("confirmed:3");
    }

    @Test
    @DisplayName("RedissonClient 가 등록되지 않으면 그대로 실행")
    void lock_비활성() {
        String result = proxy().confirm(4L, "TXN-4");

        assertThat(result).isEqualTo("confirmed:4");
    }

    private PaymentTransitions proxy() {
        AspectJProxyFactory factory = new AspectJProxyFactory(new PaymentTransitions());
        factory.setProxyTargetClass(true);
        factory.addAspect(new DistributedLockAspect(beanFactory.getBeanProvider(RedissonClient.class)));
        return factory.getProxy();
    }

    static class PaymentTransitions {

        @DistributedLock(key = "'lock:payment-tx:' + #providerTransactionId")
        public String confirm(Long orderId, String providerTransactionId) {
            return "confirmed:" + orderId;
        }
    }
}
