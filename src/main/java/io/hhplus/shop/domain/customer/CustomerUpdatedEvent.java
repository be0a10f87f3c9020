package io.hhplus.shop.domain.customer;

import io.hhplus.shop.domain.common.AggregateType;
import io.hhplus.shop.domain.common.DomainEvent;
import io.hhplus.shop.domain.common.EventKind;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

public record CustomerUpdatedEvent(
    UUID id,
    String firstName,
    String lastName,
    Gender gender,
    String email,
    LocalDate dateOfBirth,
    LocalDateTime occurredAt
) implements DomainEvent {

    public static CustomerUpdatedEvent from(Customer customer, LocalDateTime occurredAt) {
        return new CustomerUpdatedEvent(
            customer.getId(),
            customer.getFirstName(),
            customer.getLastName(),
            customer.getGender(),
            customer.getEmail(),
            customer.getDateOfBirth(),
            occurredAt
        );
    }

    @Override
    public UUID aggregateId() {
        return id;
    }

    @Override
    public AggregateType aggregateType() {
        return AggregateType.CUSTOMER;
    }

    @Override
    public EventKind kind() {
        return EventKind.UPDATED;
    }
}
