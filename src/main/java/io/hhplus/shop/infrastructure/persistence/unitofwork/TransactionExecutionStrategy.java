package io.hhplus.shop.infrastructure.persistence.unitofwork;

import lombok.RequiredArgsConstructor;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.function.IntFunction;

/**
 * 재시도 가능한 실행 전략
 *
 * 일시적 장애(데드락, 커넥션 획득 실패 등) 시 시도 전체를 처음부터 다시 실행한다.
 * 재시도 정책은 RetryConfig의 unitOfWorkRetryTemplate 을 따른다.
 */
@Component
@RequiredArgsConstructor
public class TransactionExecutionStrategy {

    private final RetryTemplate unitOfWorkRetryTemplate;

    /**
     * @param attempt 시도 번호(1부터)를 받아 한 번의 시도를 수행하는 함수
     */
    public <T> T execute(IntFunction<T> attempt) {
        return unitOfWorkRetryTemplate.execute(context -> attempt.apply(context.getRetryCount() + 1));
    }
}
