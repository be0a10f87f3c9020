package io.hhplus.shop.application.product.dto;

import io.hhplus.shop.domain.product.ProductReadModel;

import java.math.BigDecimal;
import java.util.UUID;

public record ProductResponse(
    UUID id,
    String name,
    String description,
    BigDecimal price,
    String category
) {
    public static ProductResponse from(ProductReadModel readModel) {
        return new ProductResponse(
            readModel.getId(),
            readModel.getName(),
            readModel.getDescription(),
            readModel.getPrice(),
            readModel.getCategory()
        );
    }
}
