package io.hhplus.shop.application.product;

import io.hhplus.shop.application.product.dto.CreateProductRequest;
import io.hhplus.shop.domain.common.UnitOfWork;
import io.hhplus.shop.domain.common.UnitOfWorkFactory;
import io.hhplus.shop.domain.product.Product;
import io.hhplus.shop.domain.product.ProductRepository;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.UUID;

@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class ProductService {

    private final UnitOfWorkFactory unitOfWorkFactory;
    private final ProductRepository productRepository;

    public UUID create(@Valid CreateProductRequest request) {
        Product product = Product.create(
            request.name(),
            request.description(),
            request.price(),
            request.category()
        );

        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(product);
            unitOfWork.commit();
        }

        log.info("상품 생성 완료: productId={}", product.getId());
        return product.getId();
    }

    public void update(UUID productId, @Valid CreateProductRequest request) {
        Product product = productRepository.findByIdOrThrow(productId);
        product.update(request.name(), request.description(), request.price(), request.category());

        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.update(product);
            unitOfWork.commit();
        }

        log.info("상품 수정 완료: productId={}", productId);
    }

    public void delete(UUID productId) {
        Product product = productRepository.findByIdOrThrow(productId);
        product.delete();

        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.remove(product);
            unitOfWork.commit();
        }

        log.info("상품 삭제 완료: productId={}", productId);
    }
}
