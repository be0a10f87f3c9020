package io.hhplus.shop.application.product;

import io.hhplus.shop.application.cache.CacheNames;
import io.hhplus.shop.application.product.dto.ProductResponse;
import io.hhplus.shop.common.exception.BusinessException;
import io.hhplus.shop.common.exception.ErrorCode;
import io.hhplus.shop.domain.product.ProductReadModel;
import io.hhplus.shop.domain.readmodel.ReadModelStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProductQueryService {

    private final ReadModelStore readModelStore;

    @Cacheable(
        cacheNames = CacheNames.QUERIES,
        key = "T(io.hhplus.shop.application.cache.QueryCacheKeys).GET_ALL_PRODUCTS",
        sync = true
    )
    public List<ProductResponse> getAll() {
        log.info("Getting all products from read model");

        return readModelStore.findAll(ProductReadModel.class).stream()
            .map(ProductResponse::from)
            .toList();
    }

    /**
     * 상품 단건 조회 (캐시 키: GetProductByIdQuery_{id})
     */
    @Cacheable(
        cacheNames = CacheNames.QUERIES,
        key = "T(io.hhplus.shop.application.cache.QueryCacheKeys).productById(#productId)",
        sync = true
    )
    public ProductResponse getById(UUID productId) {
        log.info("Getting product from read model: productId={}", productId);

        return readModelStore.findById(ProductReadModel.class, productId)
            .map(ProductResponse::from)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.PRODUCT_NOT_FOUND,
                "상품을 찾을 수 없습니다. productId: " + productId
            ));
    }
}
