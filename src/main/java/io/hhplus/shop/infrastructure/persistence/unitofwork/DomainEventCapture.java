package io.hhplus.shop.infrastructure.persistence.unitofwork;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.shop.common.exception.BusinessException;
import io.hhplus.shop.common.exception.ErrorCode;
import io.hhplus.shop.domain.common.AggregateRoot;
import io.hhplus.shop.domain.common.DomainEvent;
import io.hhplus.shop.domain.event.StoredEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 도메인 이벤트 수거기
 *
 * 애그리거트 대기열의 이벤트를 모아 이벤트 저장소 레코드(JSON)로 변환하고 대기열을 비운다.
 * 모든 변환이 성공한 뒤에만 대기열을 비우므로, 직렬화에 실패하면 대기열은 그대로 남는다.
 */
@Component
@RequiredArgsConstructor
public class DomainEventCapture {

    private final ObjectMapper objectMapper;

    public CapturedEvents capture(List<? extends AggregateRoot> aggregates) {
        List<CapturedEvents.Batch> batches = new ArrayList<>();
        for (AggregateRoot aggregate : aggregates) {
            if (!aggregate.hasDomainEvents()) {
                continue;
            }
            List<DomainEvent> events = List.copyOf(aggregate.getDomainEvents());
            List<StoredEvent> records = events.stream()
                .map(this::toRecord)
                .toList();
            batches.add(new CapturedEvents.Batch(aggregate, events, records));
        }

        if (batches.isEmpty()) {
            return CapturedEvents.empty();
        }
        batches.forEach(batch -> batch.aggregate().clearDomainEvents());
        return new CapturedEvents(batches);
    }

    private StoredEvent toRecord(DomainEvent event) {
        try {
            return StoredEvent.of(
                event.aggregateId(),
                event.eventName(),
                objectMapper.writeValueAsString(event),
                event.occurredAt()
            );
        } catch (JsonProcessingException e) {
            throw new BusinessException(
                ErrorCode.EVENT_SERIALIZATION_FAILED,
                "이벤트 직렬화 실패: " + event.eventName() + ", aggregateId: " + event.aggregateId(),
                e
            );
        }
    }
}
