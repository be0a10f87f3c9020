package io.hhplus.shop.domain.product;

import io.hhplus.shop.common.exception.BusinessException;
import io.hhplus.shop.common.exception.ErrorCode;
import io.hhplus.shop.domain.common.AggregateRoot;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(
    name = "products",
    indexes = {
        @Index(name = "idx_products_category", columnList = "category")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Product extends AggregateRoot {

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, length = 50)
    private String category;

    private Product(UUID id, String name, String description, BigDecimal price, String category) {
        super(id);
        this.name = name;
        this.description = description;
        this.price = price;
        this.category = category;
    }

    public static Product create(String name, String description, BigDecimal price, String category) {
        return create(UUID.randomUUID(), name, description, price, category);
    }

    public static Product create(UUID id, String name, String description, BigDecimal price, String category) {
        validate(name, price, category);

        Product product = new Product(id, name.trim(), description, price, category.trim());
        product.addDomainEvent(ProductCreatedEvent.from(product, LocalDateTime.now()));
        return product;
    }

    /**
     * 상품 정보 변경 (전체 교체)
     */
    public void update(String name, String description, BigDecimal price, String category) {
        validate(name, price, category);

        this.name = name.trim();
        this.description = description;
        this.price = price;
        this.category = category.trim();
        addDomainEvent(ProductUpdatedEvent.from(this, LocalDateTime.now()));
    }

    public void delete() {
        addDomainEvent(ProductDeletedEvent.from(this, LocalDateTime.now()));
    }

    private static void validate(String name, BigDecimal price, String category) {
        if (name == null || name.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "상품명은 필수입니다");
        }
        if (price == null || price.signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "가격은 0 이상이어야 합니다");
        }
        if (category == null || category.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "카테고리는 필수입니다");
        }
    }
}
