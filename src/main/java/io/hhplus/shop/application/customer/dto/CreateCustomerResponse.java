package io.hhplus.shop.application.customer.dto;

import io.hhplus.shop.domain.customer.Customer;

import java.util.UUID;

public record CreateCustomerResponse(
    UUID id
) {
    public static CreateCustomerResponse from(Customer customer) {
        return new CreateCustomerResponse(customer.getId());
    }
}
