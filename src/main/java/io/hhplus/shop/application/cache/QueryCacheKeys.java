package io.hhplus.shop.application.cache;

import java.util.List;
import java.util.UUID;

/**
 * 쿼리 시그니처 기반 캐시 키
 *
 * - 목록 조회: GetAllCustomerQuery
 * - 단건 조회: GetCustomerByIdQuery_{id}
 *
 * 조회 서비스의 @Cacheable 키와 프로젝션 핸들러의 무효화 키가 반드시 같아야 한다.
 */
public final class QueryCacheKeys {

    public static final String GET_ALL_CUSTOMERS = "GetAllCustomerQuery";
    public static final String GET_CUSTOMER_BY_ID_PREFIX = "GetCustomerByIdQuery_";
    public static final String GET_ALL_PRODUCTS = "GetAllProductQuery";
    public static final String GET_PRODUCT_BY_ID_PREFIX = "GetProductByIdQuery_";

    private QueryCacheKeys() {
    }

    public static String customerById(UUID id) {
        return GET_CUSTOMER_BY_ID_PREFIX + id;
    }

    public static String productById(UUID id) {
        return GET_PRODUCT_BY_ID_PREFIX + id;
    }

    /**
     * 고객 변경 시 무효화할 키 (목록 + 단건)
     */
    public static List<String> customerKeys(UUID id) {
        return List.of(GET_ALL_CUSTOMERS, customerById(id));
    }

    public static List<String> productKeys(UUID id) {
        return List.of(GET_ALL_PRODUCTS, productById(id));
    }
}
