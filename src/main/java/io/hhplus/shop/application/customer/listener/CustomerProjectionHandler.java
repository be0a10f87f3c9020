package io.hhplus.shop.application.customer.listener;

import io.hhplus.shop.application.cache.CacheInvalidator;
import io.hhplus.shop.application.cache.QueryCacheKeys;
import io.hhplus.shop.application.event.EventHandlerRegistry;
import io.hhplus.shop.application.projection.ProjectionHandler;
import io.hhplus.shop.domain.common.AggregateType;
import io.hhplus.shop.domain.common.DomainEvent;
import io.hhplus.shop.domain.common.EventKind;
import io.hhplus.shop.domain.customer.CustomerCreatedEvent;
import io.hhplus.shop.domain.customer.CustomerDeletedEvent;
import io.hhplus.shop.domain.customer.CustomerReadModel;
import io.hhplus.shop.domain.customer.CustomerUpdatedEvent;
import io.hhplus.shop.domain.readmodel.ReadModelStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 고객 읽기 모델 프로젝션 핸들러
 *
 * 책임:
 * - 생성/수정 이벤트: 읽기 모델 upsert (id 기준 전체 교체)
 * - 삭제 이벤트: 읽기 모델 id 기준 삭제
 * - 처리 후 목록/단건 쿼리 캐시 무효화
 *
 * 주의사항:
 * - 읽기 저장소 갱신 실패는 그대로 전파한다 (디스패처가 모아서 보고)
 * - 캐시 무효화 실패는 CacheInvalidator가 흡수한다
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CustomerProjectionHandler implements ProjectionHandler {

    private final ReadModelStore readModelStore;
    private final CacheInvalidator cacheInvalidator;

    @Override
    public void registerRoutes(EventHandlerRegistry registry) {
        registry
            .register(AggregateType.CUSTOMER, EventKind.CREATED, CustomerCreatedEvent.class, this::onCreated)
            .register(AggregateType.CUSTOMER, EventKind.UPDATED, CustomerUpdatedEvent.class, this::onUpdated)
            .register(AggregateType.CUSTOMER, EventKind.DELETED, CustomerDeletedEvent.class, this::onDeleted);
    }

    public void onCreated(CustomerCreatedEvent event) {
        logTriggered(event);

        readModelStore.upsert(CustomerReadModel.from(event));
        cacheInvalidator.invalidate(QueryCacheKeys.customerKeys(event.id()));
    }

    public void onUpdated(CustomerUpdatedEvent event) {
        logTriggered(event);

        readModelStore.upsert(CustomerReadModel.from(event));
        cacheInvalidator.invalidate(QueryCacheKeys.customerKeys(event.id()));
    }

    public void onDeleted(CustomerDeletedEvent event) {
        logTriggered(event);

        readModelStore.deleteById(CustomerReadModel.class, event.id());
        cacheInvalidator.invalidate(QueryCacheKeys.customerKeys(event.id()));
    }

    private void logTriggered(DomainEvent event) {
        log.info("----- Triggering the event {}, model: {}", event.eventName(), event);
    }
}
