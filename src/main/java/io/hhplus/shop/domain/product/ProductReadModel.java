package io.hhplus.shop.domain.product;

import io.hhplus.shop.domain.readmodel.ReadModel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 상품 읽기 모델
 */
@Entity
@Table(name = "product_read_model")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProductReadModel implements ReadModel {

    @Id
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, length = 50)
    private String category;

    @Column(name = "last_event_at", nullable = false)
    private LocalDateTime lastEventAt;

    public static ProductReadModel from(ProductCreatedEvent event) {
        return of(event.id(), event.name(), event.description(), event.price(),
            event.category(), event.occurredAt());
    }

    public static ProductReadModel from(ProductUpdatedEvent event) {
        return of(event.id(), event.name(), event.description(), event.price(),
            event.category(), event.occurredAt());
    }

    private static ProductReadModel of(UUID id, String name, String description, BigDecimal price,
                                       String category, LocalDateTime occurredAt) {
        ProductReadModel model = new ProductReadModel();
        model.id = id;
        model.name = name;
        model.description = description;
        model.price = price;
        model.category = category;
        model.lastEventAt = occurredAt;
        return model;
    }
}
