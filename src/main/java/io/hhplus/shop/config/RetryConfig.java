package io.hhplus.shop.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.util.Assert;

/**
 * Unit of Work 실행 전략 (재시도) 설정
 *
 * 재시도 대상 (일시적 장애만):
 * - TransientDataAccessException: 데드락, 락 획득 실패, 쿼리 타임아웃
 * - RecoverableDataAccessException: 커넥션 복구 후 재실행 가능
 * - CannotCreateTransactionException: 트랜잭션 시작 시 커넥션 획득 실패
 *
 * 제약 조건 위반(DataIntegrityViolationException) 등은 재시도하지 않고 즉시 전파한다.
 *
 * backoff-multiplier 가 1.0 이면 backoff-initial-ms 간격의 고정 backoff 를 사용한다.
 */
@Configuration
@Slf4j
public class RetryConfig {

    @Bean(name = "unitOfWorkRetryTemplate")
    public RetryTemplate unitOfWorkRetryTemplate(
            @Value("${shop.unit-of-work.max-attempts:3}") int maxAttempts,
            @Value("${shop.unit-of-work.backoff-initial-ms:100}") long initialInterval,
            @Value("${shop.unit-of-work.backoff-multiplier:2.0}") double multiplier,
            @Value("${shop.unit-of-work.backoff-max-ms:1000}") long maxInterval) {
        Assert.isTrue(maxAttempts >= 1,
            "shop.unit-of-work.max-attempts 는 1 이상이어야 합니다: " + maxAttempts);
        Assert.isTrue(initialInterval > 0,
            "shop.unit-of-work.backoff-initial-ms 는 0보다 커야 합니다: " + initialInterval);
        Assert.isTrue(multiplier >= 1.0,
            "shop.unit-of-work.backoff-multiplier 는 1.0 이상이어야 합니다: " + multiplier);

        RetryTemplateBuilder builder = RetryTemplate.builder()
            .maxAttempts(maxAttempts);

        if (multiplier == 1.0) {
            builder.fixedBackoff(initialInterval);
        } else {
            Assert.isTrue(maxInterval > initialInterval,
                "shop.unit-of-work.backoff-max-ms 는 backoff-initial-ms 보다 커야 합니다: max="
                    + maxInterval + ", initial=" + initialInterval);
            builder.exponentialBackoff(initialInterval, multiplier, maxInterval);
        }

        return builder
            .retryOn(TransientDataAccessException.class)
            .retryOn(RecoverableDataAccessException.class)
            .retryOn(CannotCreateTransactionException.class)
            .traversingCauses()
            .withListener(retryLoggingListener())
            .build();
    }

    private RetryListener retryLoggingListener() {
        return new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context,
                                                         RetryCallback<T, E> callback,
                                                         Throwable throwable) {
                log.warn("Unit of Work 커밋 시도 실패 (재시도 판단): attempt={}, error={}",
                    context.getRetryCount(), throwable.getMessage());
            }
        };
    }
}
