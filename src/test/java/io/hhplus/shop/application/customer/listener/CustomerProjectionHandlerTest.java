package io.hhplus.shop.application.customer.listener;

import io.hhplus.shop.application.cache.CacheInvalidator;
import io.hhplus.shop.application.event.EventHandlerRegistry;
import io.hhplus.shop.application.event.EventRoute;
import io.hhplus.shop.domain.common.AggregateType;
import io.hhplus.shop.domain.common.EventKind;
import io.hhplus.shop.domain.customer.Customer;
import io.hhplus.shop.domain.customer.CustomerCreatedEvent;
import io.hhplus.shop.domain.customer.CustomerDeletedEvent;
import io.hhplus.shop.domain.customer.CustomerReadModel;
import io.hhplus.shop.domain.customer.CustomerUpdatedEvent;
import io.hhplus.shop.domain.customer.Gender;
import io.hhplus.shop.domain.readmodel.ReadModelStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CustomerProjectionHandler 테스트")
class CustomerProjectionHandlerTest {

    @Mock
    private ReadModelStore readModelStore;

    @Mock
    private CacheInvalidator cacheInvalidator;

    @InjectMocks
    private CustomerProjectionHandler handler;

    private Customer customer;

    @BeforeEach
    void setUp() {
        customer = Customer.create("길동", "홍", Gender.MALE, "hong@example.com", LocalDate.of(1990, 1, 1));
    }

    @Test
    @DisplayName("생성 이벤트: 읽기 모델 upsert 후 목록/단건 캐시 키 무효화")
    void onCreated_upsert_캐시무효화() {
        // Given
        CustomerCreatedEvent event = CustomerCreatedEvent.from(customer, LocalDateTime.now());

        // When
        handler.onCreated(event);

        // Then
        ArgumentCaptor<CustomerReadModel> readModel = ArgumentCaptor.forClass(CustomerReadModel.class);
        verify(readModelStore).upsert(readModel.capture());
        assertThat(readModel.getValue().getId()).isEqualTo(customer.getId());
        assertThat(readModel.getValue().getFullName()).isEqualTo("길동 홍");
        assertThat(readModel.getValue().getEmail()).isEqualTo("hong@example.com");

        verify(cacheInvalidator).invalidate(
            List.of("GetAllCustomerQuery", "GetCustomerByIdQuery_" + customer.getId()));
    }

    @Test
    @DisplayName("수정 이벤트: 변경 후 스냅샷으로 전체 교체")
    void onUpdated_upsert() {
        // Given
        customer.changeEmail("x@example.com");
        CustomerUpdatedEvent event = CustomerUpdatedEvent.from(customer, LocalDateTime.now());

        // When
        handler.onUpdated(event);

        // Then
        ArgumentCaptor<CustomerReadModel> readModel = ArgumentCaptor.forClass(CustomerReadModel.class);
        verify(readModelStore).upsert(readModel.capture());
        assertThat(readModel.getValue().getEmail()).isEqualTo("x@example.com");
        verify(cacheInvalidator).invalidate(any());
    }

    @Test
    @DisplayName("삭제 이벤트: 이메일이 아닌 id 기준으로 삭제")
    void onDeleted_id기준삭제() {
        // Given
        CustomerDeletedEvent event = CustomerDeletedEvent.from(customer, LocalDateTime.now());

        // When
        handler.onDeleted(event);

        // Then
        verify(readModelStore).deleteById(CustomerReadModel.class, customer.getId());
        verify(readModelStore, never()).upsert(any());
        verify(cacheInvalidator).invalidate(
            List.of("GetAllCustomerQuery", "GetCustomerByIdQuery_" + customer.getId()));
    }

    @Test
    @DisplayName("읽기 저장소 실패는 전파하고 캐시는 건드리지 않는다")
    void onCreated_저장실패_전파() {
        // Given
        CustomerCreatedEvent event = CustomerCreatedEvent.from(customer, LocalDateTime.now());
        doThrow(new IllegalStateException("read store down")).when(readModelStore).upsert(any());

        // When & Then
        assertThatThrownBy(() -> handler.onCreated(event)).isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(cacheInvalidator);
    }

    @Test
    @DisplayName("고객 생성/수정/삭제 라우트를 등록한다")
    void registerRoutes() {
        // Given
        EventHandlerRegistry registry = new EventHandlerRegistry();

        // When
        handler.registerRoutes(registry);

        // Then
        assertThat(registry.routes()).containsExactlyInAnyOrder(
            new EventRoute(AggregateType.CUSTOMER, EventKind.CREATED),
            new EventRoute(AggregateType.CUSTOMER, EventKind.UPDATED),
            new EventRoute(AggregateType.CUSTOMER, EventKind.DELETED)
        );
    }
}
