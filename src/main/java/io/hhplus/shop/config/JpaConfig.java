package io.hhplus.shop.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * JPA 설정
 *
 * 같은 DataSource 위에 세 종류의 테이블을 둔다.
 * - 쓰기 모델: customers, products (Unit of Work 로만 변경)
 * - 이벤트 저장소: event_store (커밋 이후 append)
 * - 읽기 모델: customer_read_model, product_read_model (프로젝션 핸들러가 갱신)
 *
 * Auditing 은 쓰기 모델 애그리거트의 created_at / updated_at 에만 적용된다.
 */
@Configuration
@EnableJpaAuditing
@EnableJpaRepositories(basePackages = "io.hhplus.shop.infrastructure.persistence")
public class JpaConfig {
}
