package io.hhplus.shop.infrastructure.persistence.unitofwork;

import io.hhplus.shop.application.event.DomainEventPublisher;
import io.hhplus.shop.domain.common.UnitOfWork;
import io.hhplus.shop.domain.common.UnitOfWorkFactory;
import io.hhplus.shop.domain.event.EventStoreRepository;
import io.hhplus.shop.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

@Component
@RequiredArgsConstructor
public class JpaUnitOfWorkFactory implements UnitOfWorkFactory {

    private final PlatformTransactionManager transactionManager;
    private final TransactionExecutionStrategy executionStrategy;
    private final JpaWriteStore writeStore;
    private final DomainEventCapture eventCapture;
    private final EventStoreRepository eventStoreRepository;
    private final DomainEventPublisher eventPublisher;
    private final MetricsCollector metricsCollector;

    @Override
    public UnitOfWork open() {
        return new JpaUnitOfWork(
            transactionManager,
            executionStrategy,
            writeStore,
            eventCapture,
            eventStoreRepository,
            eventPublisher,
            metricsCollector
        );
    }
}
