package io.hhplus.shop.infrastructure.persistence.unitofwork;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.hhplus.shop.application.event.DomainEventPublisher;
import io.hhplus.shop.common.exception.BusinessException;
import io.hhplus.shop.common.exception.ErrorCode;
import io.hhplus.shop.domain.common.DomainEvent;
import io.hhplus.shop.domain.common.UnitOfWork;
import io.hhplus.shop.domain.customer.Customer;
import io.hhplus.shop.domain.customer.Gender;
import io.hhplus.shop.domain.event.EventStoreRepository;
import io.hhplus.shop.domain.event.StoredEvent;
import io.hhplus.shop.domain.product.Product;
import io.hhplus.shop.infrastructure.metrics.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JpaUnitOfWork 커밋 프로토콜 테스트")
class JpaUnitOfWorkTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private JpaWriteStore writeStore;

    @Mock
    private EventStoreRepository eventStoreRepository;

    @Mock
    private DomainEventPublisher eventPublisher;

    private SimpleMeterRegistry meterRegistry;
    private JpaUnitOfWorkFactory unitOfWorkFactory;

    @BeforeEach
    void setUp() {
        RetryTemplate retryTemplate = RetryTemplate.builder()
            .maxAttempts(3)
            .noBackoff()
            .retryOn(TransientDataAccessException.class)
            .traversingCauses()
            .build();

        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        meterRegistry = new SimpleMeterRegistry();
        unitOfWorkFactory = new JpaUnitOfWorkFactory(
            transactionManager,
            new TransactionExecutionStrategy(retryTemplate),
            writeStore,
            new DomainEventCapture(objectMapper),
            eventStoreRepository,
            eventPublisher,
            new MetricsCollector(meterRegistry)
        );

        lenient().when(transactionManager.getTransaction(any(TransactionDefinition.class)))
            .thenAnswer(invocation -> new SimpleTransactionStatus());
    }

    private Customer newCustomer(String email) {
        return Customer.create("길동", "홍", Gender.MALE, email, LocalDate.of(1990, 1, 1));
    }

    @Test
    @DisplayName("대기 이벤트가 없으면 이벤트 저장소 기록과 발행을 하지 않는다")
    void commit_이벤트없음_전파생략() {
        // Given
        Customer customer = newCustomer("hong@example.com");
        customer.clearDomainEvents();
        when(writeStore.saveChanges(anyList())).thenReturn(1);

        // When
        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.update(customer);
            unitOfWork.commit();
        }

        // Then
        verify(transactionManager).commit(any());
        verifyNoInteractions(eventStoreRepository, eventPublisher);
    }

    @Test
    @DisplayName("커밋 성공 시 N개의 이벤트를 같은 순서로 한 번씩 기록하고 발행한다")
    void commit_성공_기록후발행() {
        // Given
        Customer customer = newCustomer("hong@example.com");
        customer.changeEmail("x@example.com");
        Product product = Product.create("키보드", null, new BigDecimal("1000"), "ELECTRONICS");
        when(writeStore.saveChanges(anyList())).thenReturn(2);

        // When
        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(customer);
            unitOfWork.add(product);
            unitOfWork.commit();
        }

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<StoredEvent>> records = ArgumentCaptor.forClass(List.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DomainEvent>> events = ArgumentCaptor.forClass(List.class);

        InOrder inOrder = inOrder(transactionManager, eventStoreRepository, eventPublisher);
        inOrder.verify(transactionManager).commit(any());
        inOrder.verify(eventStoreRepository).store(records.capture());
        inOrder.verify(eventPublisher).publish(events.capture());

        assertThat(records.getValue())
            .extracting(StoredEvent::getMessageType)
            .containsExactly("CustomerCreatedEvent", "CustomerUpdatedEvent", "ProductCreatedEvent");
        assertThat(events.getValue()).hasSize(3);
        assertThat(customer.hasDomainEvents()).isFalse();
        assertThat(product.hasDomainEvents()).isFalse();
    }

    @Test
    @DisplayName("flush 실패 시 롤백하고, 아무것도 기록/발행하지 않으며 이벤트는 애그리거트로 되돌린다")
    void commit_flush실패_롤백() {
        // Given
        Customer customer = newCustomer("hong@example.com");
        when(writeStore.saveChanges(anyList()))
            .thenThrow(new DataIntegrityViolationException("uk_customers_email"));

        // When & Then
        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(customer);
            assertThatThrownBy(unitOfWork::commit)
                .isInstanceOf(DataIntegrityViolationException.class);
        }

        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
        verifyNoInteractions(eventStoreRepository, eventPublisher);
        assertThat(customer.getDomainEvents()).hasSize(1);
        assertThat(meterRegistry.counter("unit_of_work_rollback_total").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("unit_of_work_commit_total", "status", "failure").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("일시적 장애 후 재시도에 성공하면 이벤트를 중복 없이 한 번만 기록/발행한다")
    void commit_재시도_중복없음() {
        // Given
        Customer customer = newCustomer("hong@example.com");
        when(writeStore.saveChanges(anyList()))
            .thenThrow(new QueryTimeoutException("lock wait timeout"))
            .thenReturn(1);

        // When
        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(customer);
            unitOfWork.commit();
        }

        // Then
        verify(transactionManager, times(2)).getTransaction(any());
        verify(transactionManager, times(1)).rollback(any());
        verify(transactionManager, times(1)).commit(any());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<StoredEvent>> records = ArgumentCaptor.forClass(List.class);
        verify(eventStoreRepository, times(1)).store(records.capture());
        assertThat(records.getValue()).hasSize(1);
        verify(eventPublisher, times(1)).publish(argThat(list -> list.size() == 1));
    }

    @Test
    @DisplayName("재시도가 모두 실패하면 마지막 예외를 전파하고 이벤트는 한 벌만 남는다")
    void commit_재시도소진() {
        // Given
        Customer customer = newCustomer("hong@example.com");
        when(writeStore.saveChanges(anyList())).thenThrow(new QueryTimeoutException("lock wait timeout"));

        // When & Then
        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(customer);
            assertThatThrownBy(unitOfWork::commit).isInstanceOf(QueryTimeoutException.class);
        }

        verify(transactionManager, times(3)).rollback(any());
        verifyNoInteractions(eventStoreRepository, eventPublisher);
        assertThat(customer.getDomainEvents()).hasSize(1);
    }

    @Test
    @DisplayName("이벤트 저장소 기록 실패 시 EVENT_STORE_APPEND_FAILED, 롤백/발행하지 않는다")
    void commit_저장소기록실패() {
        // Given
        Customer customer = newCustomer("hong@example.com");
        when(writeStore.saveChanges(anyList())).thenReturn(1);
        doThrow(new QueryTimeoutException("event store down"))
            .when(eventStoreRepository).store(anyList());

        // When & Then
        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(customer);
            assertThatThrownBy(unitOfWork::commit)
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.EVENT_STORE_APPEND_FAILED)
                .hasCauseInstanceOf(QueryTimeoutException.class);
        }

        verify(transactionManager, times(1)).commit(any());
        verify(transactionManager, never()).rollback(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("이벤트 발행 실패 시 EVENT_DISPATCH_FAILED, 커밋과 이벤트 기록은 유지된다")
    void commit_발행실패() {
        // Given
        Customer customer = newCustomer("hong@example.com");
        when(writeStore.saveChanges(anyList())).thenReturn(1);
        doThrow(new BusinessException(ErrorCode.EVENT_DISPATCH_FAILED))
            .when(eventPublisher).publish(anyList());

        // When & Then
        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(customer);
            assertThatThrownBy(unitOfWork::commit)
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.EVENT_DISPATCH_FAILED);
        }

        verify(transactionManager, times(1)).commit(any());
        verify(transactionManager, never()).rollback(any());
        verify(eventStoreRepository, times(1)).store(anyList());
        assertThat(meterRegistry.counter("event_dispatch_total", "status", "failure").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("종료된 Unit of Work 는 사용할 수 없다")
    void close_이후사용불가() {
        // Given
        UnitOfWork unitOfWork = unitOfWorkFactory.open();
        unitOfWork.close();

        // When & Then
        assertThatThrownBy(() -> unitOfWork.add(newCustomer("hong@example.com")))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNIT_OF_WORK_CLOSED);
        assertThatThrownBy(unitOfWork::commit)
            .isInstanceOf(BusinessException.class);
        verifyNoInteractions(transactionManager, writeStore);
    }
}
