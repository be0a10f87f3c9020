package io.hhplus.shop.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.hhplus.shop.application.cache.CacheNames;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.interceptor.SimpleCacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.Map;

/**
 * Spring Cache 설정
 *
 * 캐시 전략: Cache-Aside 패턴
 * - 조회 시: 캐시 확인 → 없으면 읽기 모델 조회 → 캐시 저장 (@Cacheable)
 * - 갱신 시: 프로젝션 핸들러가 읽기 모델 갱신 후 쿼리 키 무효화 (CacheInvalidator)
 *
 * 캐시:
 * - queries: 쿼리 시그니처(GetAllCustomerQuery, GetCustomerByIdQuery_{id} ...) 단위 캐시
 *
 * Note: test 프로파일에서는 Redis 대신 ConcurrentMapCacheManager 사용
 */
@Configuration
@EnableCaching
public class CacheConfig implements CachingConfigurer {

    /**
     * Jackson ObjectMapper 설정
     * - JavaTimeModule: LocalDate / LocalDateTime 지원
     * - record DTO는 final이므로 EVERYTHING으로 타입 정보를 남긴다.
     */
    private ObjectMapper cacheObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        BasicPolymorphicTypeValidator ptv = BasicPolymorphicTypeValidator.builder()
            .allowIfSubType("io.hhplus.shop")
            .allowIfSubType("java.util.List")
            .allowIfSubType("java.util.ArrayList")
            .allowIfSubType("java.util.ImmutableCollections")
            .allowIfSubType("java.util.UUID")
            .allowIfSubType("java.math.BigDecimal")
            .allowIfSubType("java.time")
            .allowIfSubType("java.lang.Long")
            .allowIfSubType("java.lang.Integer")
            .allowIfSubType("java.lang.String")
            .build();
        mapper.activateDefaultTyping(ptv, ObjectMapper.DefaultTyping.EVERYTHING, JsonTypeInfo.As.PROPERTY);
        return mapper;
    }

    private RedisCacheConfiguration defaultCacheConfig(Duration ttl) {
        return RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(ttl)
                .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                                new StringRedisSerializer()
                        )
                )
                .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                                new GenericJackson2JsonRedisSerializer(cacheObjectMapper())
                        )
                )
                .disableCachingNullValues();
    }

    /**
     * RedisCacheManager 설정 (운영)
     * - queries TTL: shop.cache.queries-ttl (기본 10분)
     * - 무효화가 실패해도 TTL이 지나면 최신 읽기 모델로 수렴
     */
    @Bean
    @Profile("!test")
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory,
                                     @Value("${shop.cache.queries-ttl:10m}") Duration queriesTtl) {
        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(defaultCacheConfig(queriesTtl))
                .withInitialCacheConfigurations(Map.of(CacheNames.QUERIES, defaultCacheConfig(queriesTtl)))
                .build();
    }

    /**
     * 테스트 환경용 인메모리 캐시
     */
    @Bean
    @Profile("test")
    public CacheManager inMemoryCacheManager() {
        return new ConcurrentMapCacheManager(CacheNames.QUERIES);
    }

    /**
     * 캐시 역직렬화 오류 시 해당 키를 제거해 반복 오류를 방지한다.
     * Redis 장애로 제거까지 실패하면 원래 조회 예외에 suppressed 로 붙여 전파한다.
     */
    @Override
    public CacheErrorHandler errorHandler() {
        return new SimpleCacheErrorHandler() {
            @Override
            public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
                try {
                    cache.evict(key);
                } catch (RuntimeException evictFailure) {
                    exception.addSuppressed(evictFailure);
                }
                super.handleCacheGetError(exception, cache, key);
            }
        };
    }
}
