package io.hhplus.shop.infrastructure.persistence.product;

import io.hhplus.shop.domain.product.Product;
import io.hhplus.shop.domain.product.ProductRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface JpaProductRepository extends JpaRepository<Product, UUID>, ProductRepository {

    @Override
    Optional<Product> findById(UUID id);
}
