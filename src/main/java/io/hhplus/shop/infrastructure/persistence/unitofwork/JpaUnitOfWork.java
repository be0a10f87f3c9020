package io.hhplus.shop.infrastructure.persistence.unitofwork;

import io.hhplus.shop.application.event.DomainEventPublisher;
import io.hhplus.shop.common.exception.BusinessException;
import io.hhplus.shop.common.exception.ErrorCode;
import io.hhplus.shop.domain.common.AggregateRoot;
import io.hhplus.shop.domain.common.UnitOfWork;
import io.hhplus.shop.domain.event.EventStoreRepository;
import io.hhplus.shop.infrastructure.metrics.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

/**
 * JPA 기반 Unit of Work
 *
 * 커밋 프로토콜:
 * 1. 실행 전략(재시도)이 아래 2~4를 한 번의 시도로 감싼다
 * 2. READ_COMMITTED 트랜잭션 시작, 트랜잭션 ID 부여
 * 3. 추적 중인 애그리거트에서 도메인 이벤트 수거 (flush 전)
 * 4. 변경 적용 + flush 후 커밋
 *    - 실패 시 롤백, 수거한 이벤트를 애그리거트에 되돌리고 예외 전파
 * 5. 커밋 이후: 이벤트 저장소 기록 → 이벤트 발행 (수거한 이벤트가 없으면 생략)
 *    - 실패 시 BusinessException 으로 보고. 이미 커밋된 트랜잭션은 롤백하지 않는다
 *
 * 요청마다 JpaUnitOfWorkFactory 로 새로 만들어 사용하며 스레드 간에 공유하지 않는다.
 */
@Slf4j
public class JpaUnitOfWork implements UnitOfWork {

    private final PlatformTransactionManager transactionManager;
    private final TransactionExecutionStrategy executionStrategy;
    private final JpaWriteStore writeStore;
    private final DomainEventCapture eventCapture;
    private final EventStoreRepository eventStoreRepository;
    private final DomainEventPublisher eventPublisher;
    private final MetricsCollector metricsCollector;

    private final ChangeTracker changeTracker = new ChangeTracker();
    private boolean closed;

    JpaUnitOfWork(PlatformTransactionManager transactionManager,
                  TransactionExecutionStrategy executionStrategy,
                  JpaWriteStore writeStore,
                  DomainEventCapture eventCapture,
                  EventStoreRepository eventStoreRepository,
                  DomainEventPublisher eventPublisher,
                  MetricsCollector metricsCollector) {
        this.transactionManager = transactionManager;
        this.executionStrategy = executionStrategy;
        this.writeStore = writeStore;
        this.eventCapture = eventCapture;
        this.eventStoreRepository = eventStoreRepository;
        this.eventPublisher = eventPublisher;
        this.metricsCollector = metricsCollector;
    }

    @Override
    public void add(AggregateRoot aggregate) {
        ensureOpen();
        changeTracker.track(aggregate, EntryState.ADDED);
    }

    @Override
    public void update(AggregateRoot aggregate) {
        ensureOpen();
        changeTracker.track(aggregate, EntryState.MODIFIED);
    }

    @Override
    public void remove(AggregateRoot aggregate) {
        ensureOpen();
        changeTracker.track(aggregate, EntryState.DELETED);
    }

    @Override
    public void commit() {
        ensureOpen();
        long startedAt = System.nanoTime();

        CommitResult result;
        try {
            result = executionStrategy.execute(this::commitAttempt);
            metricsCollector.recordCommitSuccess();
        } catch (RuntimeException e) {
            metricsCollector.recordCommitFailure();
            throw e;
        } finally {
            metricsCollector.recordCommitDuration(System.nanoTime() - startedAt);
        }
        changeTracker.clear();

        if (!result.captured().isEmpty()) {
            propagate(result);
        }

        log.info("----- Transaction successfully confirmed: '{}', Rows Affected: {}",
            result.context().transactionId(), result.rowsAffected());
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        changeTracker.clear();
    }

    /**
     * 커밋 시도 1회. 실패하면 롤백 후 예외를 그대로 던져 실행 전략이 재시도 여부를 판단한다.
     */
    private CommitResult commitAttempt(int attempt) {
        TransactionContext context = TransactionContext.begin(attempt);
        TransactionStatus status = transactionManager.getTransaction(context.toDefinition());
        log.info("----- Begin transaction: '{}' (attempt {})", context.transactionId(), attempt);

        CapturedEvents captured = CapturedEvents.empty();
        try {
            captured = eventCapture.capture(changeTracker.aggregates());
            int rowsAffected = writeStore.saveChanges(changeTracker.entries());

            log.info("----- Commit transaction: '{}'", context.transactionId());
            transactionManager.commit(status);
            return new CommitResult(context, rowsAffected, captured);
        } catch (RuntimeException e) {
            rollback(context, status, e);
            captured.restore();
            log.error("An unexpected exception occurred while committing the transaction: '{}', message: {}",
                context.transactionId(), e.getMessage(), e);
            throw e;
        }
    }

    private void rollback(TransactionContext context, TransactionStatus status, RuntimeException cause) {
        metricsCollector.recordRollback();
        if (status.isCompleted()) {
            // 커밋 도중 실패: 트랜잭션 매니저가 이미 롤백 처리함
            return;
        }
        log.warn("----- Rollback transaction: '{}'", context.transactionId());
        try {
            transactionManager.rollback(status);
        } catch (RuntimeException rollbackFailure) {
            log.error("롤백 실패: transactionId={}", context.transactionId(), rollbackFailure);
            cause.addSuppressed(rollbackFailure);
        }
    }

    /**
     * 커밋 이후 전파: 이벤트 저장소 기록 → 발행
     * 저장소 기록에 실패하면 발행하지 않는다.
     */
    private void propagate(CommitResult result) {
        String transactionId = result.context().transactionId();
        CapturedEvents captured = result.captured();

        try {
            eventStoreRepository.store(captured.records());
            metricsCollector.recordEventStoreSuccess();
        } catch (RuntimeException e) {
            metricsCollector.recordEventStoreFailure();
            log.error("이벤트 저장소 기록 실패 (쓰기 저장소는 커밋됨, 재조정 필요): transactionId={}, events={}",
                transactionId, captured.size(), e);
            throw new BusinessException(
                ErrorCode.EVENT_STORE_APPEND_FAILED,
                "이벤트 저장소 기록 실패. transactionId: " + transactionId,
                e
            );
        }

        try {
            eventPublisher.publish(captured.events());
            metricsCollector.recordDispatchSuccess();
        } catch (BusinessException e) {
            metricsCollector.recordDispatchFailure();
            log.error("이벤트 발행 실패 (쓰기 저장소/이벤트 저장소는 커밋됨): transactionId={}, code={}",
                transactionId, e.getCode(), e);
            throw e;
        } catch (RuntimeException e) {
            metricsCollector.recordDispatchFailure();
            log.error("이벤트 발행 실패 (쓰기 저장소/이벤트 저장소는 커밋됨): transactionId={}",
                transactionId, e);
            throw new BusinessException(
                ErrorCode.EVENT_DISPATCH_FAILED,
                "이벤트 발행 실패. transactionId: " + transactionId,
                e
            );
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new BusinessException(ErrorCode.UNIT_OF_WORK_CLOSED);
        }
    }

    private record CommitResult(TransactionContext context, int rowsAffected, CapturedEvents captured) {
    }
}
