package io.hhplus.shop.domain.customer;

import io.hhplus.shop.domain.common.AggregateType;
import io.hhplus.shop.domain.common.DomainEvent;
import io.hhplus.shop.domain.common.EventKind;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 고객 삭제 이벤트
 * - 읽기 모델은 id 기준으로 삭제된다. 나머지 필드는 감사/추적용 마지막 스냅샷
 */
public record CustomerDeletedEvent(
    UUID id,
    String firstName,
    String lastName,
    Gender gender,
    String email,
    LocalDate dateOfBirth,
    LocalDateTime occurredAt
) implements DomainEvent {

    public static CustomerDeletedEvent from(Customer customer, LocalDateTime occurredAt) {
        return new CustomerDeletedEvent(
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
        return EventKind.DELETED;
    }
}
