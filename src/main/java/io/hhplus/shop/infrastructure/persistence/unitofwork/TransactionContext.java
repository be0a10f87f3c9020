package io.hhplus.shop.infrastructure.persistence.unitofwork;

import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.util.UUID;

/**
 * 커밋 시도 1회의 트랜잭션 정보
 *
 * @param transactionId 로그 추적용 식별자
 * @param attempt       1부터 시작하는 시도 번호
 */
public record TransactionContext(String transactionId, int attempt) {

    public static TransactionContext begin(int attempt) {
        return new TransactionContext(UUID.randomUUID().toString(), attempt);
    }

    /**
     * READ_COMMITTED, 항상 새 트랜잭션 (호출자 트랜잭션에 참여하지 않음)
     */
    public TransactionDefinition toDefinition() {
        DefaultTransactionDefinition definition =
            new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        definition.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        definition.setName("unit-of-work-" + transactionId);
        return definition;
    }
}
