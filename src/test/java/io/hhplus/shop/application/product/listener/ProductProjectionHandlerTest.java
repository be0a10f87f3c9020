package io.hhplus.shop.application.product.listener;

import io.hhplus.shop.application.cache.CacheInvalidator;
import io.hhplus.shop.application.event.EventHandlerRegistry;
import io.hhplus.shop.application.event.EventRoute;
import io.hhplus.shop.domain.product.Product;
import io.hhplus.shop.domain.product.ProductCreatedEvent;
import io.hhplus.shop.domain.product.ProductDeletedEvent;
import io.hhplus.shop.domain.product.ProductReadModel;
import io.hhplus.shop.domain.readmodel.ReadModelStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProductProjectionHandlerTest {

    @Mock
    private ReadModelStore readModelStore;

    @Mock
    private CacheInvalidator cacheInvalidator;

    @InjectMocks
    private ProductProjectionHandler handler;

    @Test
    @DisplayName("레지스트리를 통해 전달된 생성 이벤트를 읽기 모델로 반영한다")
    void created_레지스트리경유() {
        // Given
        EventHandlerRegistry registry = new EventHandlerRegistry();
        handler.registerRoutes(registry);
        Product product = Product.create("키보드", "기계식", new BigDecimal("89000"), "ELECTRONICS");
        ProductCreatedEvent event = (ProductCreatedEvent) product.getDomainEvents().get(0);

        // When
        registry.handlersFor(EventRoute.of(event)).forEach(h -> h.handle(event));

        // Then
        ArgumentCaptor<ProductReadModel> readModel = ArgumentCaptor.forClass(ProductReadModel.class);
        verify(readModelStore).upsert(readModel.capture());
        assertThat(readModel.getValue().getName()).isEqualTo("키보드");
        assertThat(readModel.getValue().getPrice()).isEqualByComparingTo("89000");
        verify(cacheInvalidator).invalidate(
            List.of("GetAllProductQuery", "GetProductByIdQuery_" + product.getId()));
    }

    @Test
    @DisplayName("삭제 이벤트는 id 기준으로 읽기 모델을 지운다")
    void deleted_id기준() {
        // Given
        Product product = Product.create("키보드", null, new BigDecimal("1000"), "ELECTRONICS");
        product.delete();
        ProductDeletedEvent event = (ProductDeletedEvent) product.getDomainEvents().get(1);

        // When
        handler.onDeleted(event);

        // Then
        verify(readModelStore).deleteById(ProductReadModel.class, product.getId());
    }
}
