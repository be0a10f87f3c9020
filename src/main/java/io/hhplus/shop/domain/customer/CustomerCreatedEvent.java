package io.hhplus.shop.domain.customer;

import io.hhplus.shop.domain.common.AggregateType;
import io.hhplus.shop.domain.common.DomainEvent;
import io.hhplus.shop.domain.common.EventKind;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 고객 생성 이벤트 (생성 시점 전체 스냅샷)
 */
public record CustomerCreatedEvent(
    UUID id,
    String firstName,
    String lastName,
    Gender gender,
    String email,
    LocalDate dateOfBirth,
    LocalDateTime occurredAt
) implements DomainEvent {

    public static CustomerCreatedEvent from(Customer customer, LocalDateTime occurredAt) {
        return new CustomerCreatedEvent(
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
        return EventKind.CREATED;
    }
}
