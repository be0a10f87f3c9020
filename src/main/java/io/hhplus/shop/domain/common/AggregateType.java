package io.hhplus.shop.domain.common;

public enum AggregateType {
    CUSTOMER,
    PRODUCT
}
