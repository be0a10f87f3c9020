package io.hhplus.shop.domain.customer;

public enum Gender {
    MALE,
    FEMALE,
    OTHER
}
