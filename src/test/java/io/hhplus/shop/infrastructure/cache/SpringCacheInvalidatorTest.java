package io.hhplus.shop.infrastructure.cache;

import io.hhplus.shop.application.cache.CacheNames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpringCacheInvalidatorTest {

    @Test
    @DisplayName("지정한 키만 제거하고 없는 키는 무시한다")
    void invalidate_지정키제거() {
        // Given
        CacheManager cacheManager = new ConcurrentMapCacheManager(CacheNames.QUERIES);
        Cache cache = cacheManager.getCache(CacheNames.QUERIES);
        cache.put("GetAllCustomerQuery", List.of("cached"));
        cache.put("GetCustomerByIdQuery_1", "cached");
        cache.put("GetAllProductQuery", List.of("kept"));
        SpringCacheInvalidator invalidator = new SpringCacheInvalidator(cacheManager);

        // When
        invalidator.invalidate(List.of("GetAllCustomerQuery", "GetCustomerByIdQuery_1", "GetCustomerByIdQuery_404"));

        // Then
        assertThat(cache.get("GetAllCustomerQuery")).isNull();
        assertThat(cache.get("GetCustomerByIdQuery_1")).isNull();
        assertThat(cache.get("GetAllProductQuery")).isNotNull();
    }

    @Test
    @DisplayName("캐시 장애는 예외 없이 흡수하고 나머지 키 무효화를 계속한다")
    void invalidate_장애흡수() {
        // Given
        CacheManager cacheManager = mock(CacheManager.class);
        Cache cache = mock(Cache.class);
        when(cacheManager.getCache(CacheNames.QUERIES)).thenReturn(cache);
        doThrow(new IllegalStateException("redis down")).when(cache).evict("GetAllCustomerQuery");
        SpringCacheInvalidator invalidator = new SpringCacheInvalidator(cacheManager);

        // When & Then
        assertThatCode(() -> invalidator.invalidate(List.of("GetAllCustomerQuery", "GetCustomerByIdQuery_1")))
            .doesNotThrowAnyException();
        verify(cache).evict("GetCustomerByIdQuery_1");
    }
}
