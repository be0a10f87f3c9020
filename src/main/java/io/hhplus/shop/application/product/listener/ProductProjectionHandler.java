package io.hhplus.shop.application.product.listener;

import io.hhplus.shop.application.cache.CacheInvalidator;
import io.hhplus.shop.application.cache.QueryCacheKeys;
import io.hhplus.shop.application.event.EventHandlerRegistry;
import io.hhplus.shop.application.projection.ProjectionHandler;
import io.hhplus.shop.domain.common.AggregateType;
import io.hhplus.shop.domain.common.DomainEvent;
import io.hhplus.shop.domain.common.EventKind;
import io.hhplus.shop.domain.product.ProductCreatedEvent;
import io.hhplus.shop.domain.product.ProductDeletedEvent;
import io.hhplus.shop.domain.product.ProductReadModel;
import io.hhplus.shop.domain.product.ProductUpdatedEvent;
import io.hhplus.shop.domain.readmodel.ReadModelStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 상품 읽기 모델 프로젝션 핸들러 (CustomerProjectionHandler와 동일한 규칙)
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProductProjectionHandler implements ProjectionHandler {

    private final ReadModelStore readModelStore;
    private final CacheInvalidator cacheInvalidator;

    @Override
    public void registerRoutes(EventHandlerRegistry registry) {
        registry
            .register(AggregateType.PRODUCT, EventKind.CREATED, ProductCreatedEvent.class, this::onCreated)
            .register(AggregateType.PRODUCT, EventKind.UPDATED, ProductUpdatedEvent.class, this::onUpdated)
            .register(AggregateType.PRODUCT, EventKind.DELETED, ProductDeletedEvent.class, this::onDeleted);
    }

    public void onCreated(ProductCreatedEvent event) {
        logTriggered(event);

        readModelStore.upsert(ProductReadModel.from(event));
        cacheInvalidator.invalidate(QueryCacheKeys.productKeys(event.id()));
    }

    public void onUpdated(ProductUpdatedEvent event) {
        logTriggered(event);

        readModelStore.upsert(ProductReadModel.from(event));
        cacheInvalidator.invalidate(QueryCacheKeys.productKeys(event.id()));
    }

    public void onDeleted(ProductDeletedEvent event) {
        logTriggered(event);

        readModelStore.deleteById(ProductReadModel.class, event.id());
        cacheInvalidator.invalidate(QueryCacheKeys.productKeys(event.id()));
    }

    private void logTriggered(DomainEvent event) {
        log.info("----- Triggering the event {}, model: {}", event.eventName(), event);
    }
}
