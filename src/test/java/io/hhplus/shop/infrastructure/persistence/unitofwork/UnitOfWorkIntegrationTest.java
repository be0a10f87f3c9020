package io.hhplus.shop.infrastructure.persistence.unitofwork;

import io.hhplus.shop.application.cache.CacheNames;
import io.hhplus.shop.application.cache.QueryCacheKeys;
import io.hhplus.shop.application.customer.listener.CustomerProjectionHandler;
import io.hhplus.shop.domain.common.UnitOfWork;
import io.hhplus.shop.domain.common.UnitOfWorkFactory;
import io.hhplus.shop.domain.customer.Customer;
import io.hhplus.shop.domain.customer.CustomerCreatedEvent;
import io.hhplus.shop.domain.customer.CustomerReadModel;
import io.hhplus.shop.domain.customer.CustomerRepository;
import io.hhplus.shop.domain.customer.Gender;
import io.hhplus.shop.domain.event.EventStoreRepository;
import io.hhplus.shop.domain.event.StoredEvent;
import io.hhplus.shop.domain.readmodel.ReadModelStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit of Work 통합 테스트 (H2)
 *
 * 쓰기 저장소 커밋 → 이벤트 저장소 기록 → 프로젝션 → 캐시 무효화 전체 흐름 검증
 */
@SpringBootTest
@ActiveProfiles("test")
class UnitOfWorkIntegrationTest {

    @Autowired
    private UnitOfWorkFactory unitOfWorkFactory;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private EventStoreRepository eventStoreRepository;

    @Autowired
    private ReadModelStore readModelStore;

    @Autowired
    private CustomerProjectionHandler customerProjectionHandler;

    @Autowired
    private CacheManager cacheManager;

    private Cache queries;

    @BeforeEach
    void setUp() {
        queries = cacheManager.getCache(CacheNames.QUERIES);
        queries.clear();
    }

    private String uniqueEmail() {
        return "user-" + UUID.randomUUID().toString().substring(0, 8) + "@example.com";
    }

    private Customer newCustomer(String email) {
        return Customer.create("길동", "홍", Gender.MALE, email, LocalDate.of(1990, 1, 1));
    }

    @Test
    @DisplayName("같은 커밋에서 생성 후 수정하면 읽기 모델은 수정 값 하나만 남고 관련 캐시 키는 제거된다")
    void commit_생성후수정_같은커밋() {
        // Given
        Customer customer = newCustomer(uniqueEmail());
        String changedEmail = uniqueEmail();
        customer.changeEmail(changedEmail);

        queries.put(QueryCacheKeys.GET_ALL_CUSTOMERS, List.of("stale"));
        queries.put(QueryCacheKeys.customerById(customer.getId()), "stale");

        // When
        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(customer);
            unitOfWork.commit();
        }

        // Then
        CustomerReadModel readModel = readModelStore.findById(CustomerReadModel.class, customer.getId()).orElseThrow();
        assertThat(readModel.getEmail()).isEqualTo(changedEmail);
        assertThat(readModelStore.findAll(CustomerReadModel.class))
            .filteredOn(model -> model.getId().equals(customer.getId()))
            .hasSize(1);

        assertThat(queries.get(QueryCacheKeys.GET_ALL_CUSTOMERS)).isNull();
        assertThat(queries.get(QueryCacheKeys.customerById(customer.getId()))).isNull();

        assertThat(eventStoreRepository.findByAggregateId(customer.getId()))
            .extracting(StoredEvent::getMessageType)
            .containsExactly("CustomerCreatedEvent", "CustomerUpdatedEvent");
        assertThat(customerRepository.findById(customer.getId())).isPresent();
        assertThat(customer.hasDomainEvents()).isFalse();
    }

    @Test
    @DisplayName("같은 생성 이벤트를 두 번 적용해도 읽기 모델 결과는 한 번 적용한 것과 같다")
    void projection_재전달_멱등() {
        // Given
        Customer customer = newCustomer(uniqueEmail());
        CustomerCreatedEvent event = (CustomerCreatedEvent) customer.getDomainEvents().get(0);

        // When
        customerProjectionHandler.onCreated(event);
        CustomerReadModel once = readModelStore.findById(CustomerReadModel.class, customer.getId()).orElseThrow();
        customerProjectionHandler.onCreated(event);
        CustomerReadModel twice = readModelStore.findById(CustomerReadModel.class, customer.getId()).orElseThrow();

        // Then
        assertThat(twice)
            .usingRecursiveComparison()
            .isEqualTo(once);
        assertThat(readModelStore.findAll(CustomerReadModel.class))
            .filteredOn(model -> model.getId().equals(customer.getId()))
            .hasSize(1);
    }

    @Test
    @DisplayName("flush 중 제약 조건 위반 시 실패를 보고하고 이벤트 저장소/읽기 저장소에 아무것도 남지 않는다")
    void commit_제약조건위반() {
        // Given
        String email = uniqueEmail();
        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(newCustomer(email));
            unitOfWork.commit();
        }
        long storedBefore = eventStoreRepository.count();
        Customer duplicate = newCustomer(email);

        // When & Then
        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(duplicate);
            assertThatThrownBy(unitOfWork::commit)
                .isInstanceOf(DataIntegrityViolationException.class);
        }

        assertThat(customerRepository.findById(duplicate.getId())).isEmpty();
        assertThat(eventStoreRepository.findByAggregateId(duplicate.getId())).isEmpty();
        assertThat(eventStoreRepository.count()).isEqualTo(storedBefore);
        assertThat(readModelStore.findById(CustomerReadModel.class, duplicate.getId())).isEmpty();
        assertThat(duplicate.getDomainEvents()).hasSize(1);
    }

    @Test
    @DisplayName("대기 이벤트가 없는 커밋은 이벤트 저장소에 기록하지 않는다")
    void commit_이벤트없음() {
        // Given
        Customer customer = newCustomer(uniqueEmail());
        customer.clearDomainEvents();
        long storedBefore = eventStoreRepository.count();

        // When
        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(customer);
            unitOfWork.commit();
        }

        // Then
        assertThat(customerRepository.findById(customer.getId())).isPresent();
        assertThat(eventStoreRepository.count()).isEqualTo(storedBefore);
        assertThat(readModelStore.findById(CustomerReadModel.class, customer.getId())).isEmpty();
    }
}
