package io.hhplus.shop.application.customer;

import io.hhplus.shop.application.cache.CacheNames;
import io.hhplus.shop.application.customer.dto.CustomerResponse;
import io.hhplus.shop.common.exception.BusinessException;
import io.hhplus.shop.common.exception.ErrorCode;
import io.hhplus.shop.domain.customer.CustomerReadModel;
import io.hhplus.shop.domain.readmodel.ReadModelStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * 고객 조회 서비스 (읽기 모델 + 쿼리 캐시)
 *
 * 캐시 키: QueryCacheKeys와 동일한 쿼리 시그니처
 * - 목록: GetAllCustomerQuery
 * - 단건: GetCustomerByIdQuery_{id}
 *
 * sync=true: 동일 키 동시 요청 시 첫 요청만 읽기 저장소 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerQueryService {

    private final ReadModelStore readModelStore;

    @Cacheable(
        cacheNames = CacheNames.QUERIES,
        key = "T(io.hhplus.shop.application.cache.QueryCacheKeys).GET_ALL_CUSTOMERS",
        sync = true
    )
    public List<CustomerResponse> getAll() {
        log.info("Getting all customers from read model");

        return readModelStore.findAll(CustomerReadModel.class).stream()
            .map(CustomerResponse::from)
            .toList();
    }

    @Cacheable(
        cacheNames = CacheNames.QUERIES,
        key = "T(io.hhplus.shop.application.cache.QueryCacheKeys).customerById(#customerId)",
        sync = true
    )
    public CustomerResponse getById(UUID customerId) {
        log.info("Getting customer from read model: customerId={}", customerId);

        return readModelStore.findById(CustomerReadModel.class, customerId)
            .map(CustomerResponse::from)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.CUSTOMER_NOT_FOUND,
                "고객을 찾을 수 없습니다. customerId: " + customerId
            ));
    }
}
