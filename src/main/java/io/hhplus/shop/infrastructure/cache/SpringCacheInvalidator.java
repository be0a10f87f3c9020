package io.hhplus.shop.infrastructure.cache;

import io.hhplus.shop.application.cache.CacheInvalidator;
import io.hhplus.shop.application.cache.CacheNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Spring Cache 기반 쿼리 캐시 무효화
 *
 * 무효화 실패는 경고 로그만 남긴다. 남은 항목은 TTL 이 지나면 만료된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringCacheInvalidator implements CacheInvalidator {

    private final CacheManager cacheManager;

    @Override
    public void invalidate(Collection<String> keys) {
        if (keys.isEmpty()) {
            return;
        }

        Cache cache;
        try {
            cache = cacheManager.getCache(CacheNames.QUERIES);
        } catch (RuntimeException e) {
            log.warn("캐시 조회 실패, 무효화 생략: cache={}, keys={}", CacheNames.QUERIES, keys, e);
            return;
        }
        if (cache == null) {
            log.warn("캐시가 없어 무효화 생략: cache={}", CacheNames.QUERIES);
            return;
        }

        for (String key : keys) {
            try {
                cache.evict(key);
            } catch (RuntimeException e) {
                log.warn("캐시 무효화 실패: cache={}, key={}", CacheNames.QUERIES, key, e);
            }
        }
        log.debug("캐시 무효화 완료: keys={}", keys);
    }
}
