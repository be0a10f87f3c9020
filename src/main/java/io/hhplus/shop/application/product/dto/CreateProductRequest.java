package io.hhplus.shop.application.product.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * 상품 생성/수정 요청 DTO
 */
public record CreateProductRequest(
    @NotBlank(message = "상품명은 필수입니다")
    @Size(max = 200, message = "상품명은 200자를 넘을 수 없습니다")
    String name,

    String description,

    @NotNull(message = "가격은 필수입니다")
    @DecimalMin(value = "0", message = "가격은 0 이상이어야 합니다")
    BigDecimal price,

    @NotBlank(message = "카테고리는 필수입니다")
    @Size(max = 50, message = "카테고리는 50자를 넘을 수 없습니다")
    String category
) {
}
