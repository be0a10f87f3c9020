package io.hhplus.shop.infrastructure.persistence.unitofwork;

import io.hhplus.shop.domain.common.AggregateRoot;
import io.hhplus.shop.domain.common.DomainEvent;
import io.hhplus.shop.domain.event.StoredEvent;

import java.util.List;

/**
 * 한 번의 커밋 시도에서 수거한 이벤트
 *
 * 애그리거트 등록 순서, 애그리거트 내 발생 순서를 그대로 유지한다.
 * events()와 records()는 1:1, 같은 순서.
 */
public final class CapturedEvents {

    private static final CapturedEvents EMPTY = new CapturedEvents(List.of());

    private final List<Batch> batches;

    CapturedEvents(List<Batch> batches) {
        this.batches = List.copyOf(batches);
    }

    public static CapturedEvents empty() {
        return EMPTY;
    }

    public List<DomainEvent> events() {
        return batches.stream()
            .flatMap(batch -> batch.events().stream())
            .toList();
    }

    public List<StoredEvent> records() {
        return batches.stream()
            .flatMap(batch -> batch.records().stream())
            .toList();
    }

    public boolean isEmpty() {
        return batches.isEmpty();
    }

    public int size() {
        return batches.stream()
            .mapToInt(batch -> batch.events().size())
            .sum();
    }

    /**
     * 롤백된 시도의 이벤트를 각 애그리거트 대기열에 되돌린다.
     */
    void restore() {
        batches.forEach(batch -> batch.aggregate().restoreDomainEvents(batch.events()));
    }

    record Batch(AggregateRoot aggregate, List<DomainEvent> events, List<StoredEvent> records) {
    }
}
