package io.hhplus.shop.application.cache;

import java.util.Collection;

/**
 * 쿼리 캐시 무효화 포트
 *
 * 최선 노력(best-effort): 실패해도 예외를 던지지 않는다.
 */
public interface CacheInvalidator {

    void invalidate(Collection<String> keys);
}
