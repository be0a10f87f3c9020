package io.hhplus.shop.domain.product;

import io.hhplus.shop.domain.common.AggregateType;
import io.hhplus.shop.domain.common.DomainEvent;
import io.hhplus.shop.domain.common.EventKind;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record ProductCreatedEvent(
    UUID id,
    String name,
    String description,
    BigDecimal price,
    String category,
    LocalDateTime occurredAt
) implements DomainEvent {

    public static ProductCreatedEvent from(Product product, LocalDateTime occurredAt) {
        return new ProductCreatedEvent(
            product.getId(),
            product.getName(),
            product.getDescription(),
            product.getPrice(),
            product.getCategory(),
            occurredAt
        );
    }

    @Override
    public UUID aggregateId() {
        return id;
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.PRODUCT;
    }

    @Override
    public EventKind kind() {
        return EventKind.CREATED;
    }
}
