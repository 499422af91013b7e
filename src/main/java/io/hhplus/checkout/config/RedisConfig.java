package io.hhplus.checkout.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 설정
 *
 * 결제 트랜잭션 단위 분산 락(DistributedLockAspect)에만 사용한다.
 * 락은 보조 수단이므로 checkout.lock.enabled=false 로 끌 수 있고,
 * 이 경우 Aspect는 락 없이 그대로 진행한다.
 */
@Configuration
@ConditionalOnProperty(name = "checkout.lock.enabled", havingValue = "true", matchIfMissing = true)
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();

        config.useSingleServer()
                .setAddress("redis://" + redisHost + ":" + redisPort)
                .setConnectionPoolSize(32)          // 커넥션 풀 크기
                .setConnectionMinimumIdleSize(4)    // 최소 유휴 커넥션
                .setRetryAttempts(1)                // 락은 fail-open 이므로 재시도 최소화
                .setRetryInterval(500)              // 재시도 간격 (ms)
                .setTimeout(1000)                   // 응답 타임아웃 (ms)
                .setPingConnectionInterval(30000);  // Ping 간격 (30초)

        return Redisson.create(config);
    }
}
