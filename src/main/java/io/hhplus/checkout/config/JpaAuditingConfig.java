package io.hhplus.checkout.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 설정
 * - @CreatedDate, @LastModifiedDate 자동 처리
 * - 조건부 UPDATE 쿼리(@Modifying)는 엔티티 리스너를 거치지 않으므로 갱신 시각을 직접 지정한다
 */
@Configuration
@EnableJpaAuditing
public class JpaAuditingConfig {
}
