package io.hhplus.shop.infrastructure.persistence.unitofwork;

import io.hhplus.shop.common.exception.BusinessException;
import io.hhplus.shop.common.exception.ErrorCode;
import io.hhplus.shop.domain.common.AggregateRoot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Unit of Work 변경 추적기
 *
 * 등록 순서를 유지하며, 같은 인스턴스를 여러 번 등록하면 상태를 병합한다.
 * - ADDED 후 수정 → ADDED (INSERT 한 번)
 * - 무엇이든 삭제 → DELETED
 * - DELETED 후 다시 추가/수정, MODIFIED 후 추가 → 예외
 *
 * 한 Unit of Work 인스턴스 안에서만 사용되므로 동기화하지 않는다.
 */
class ChangeTracker {

    private final List<TrackedEntry> entries = new ArrayList<>();

    void track(AggregateRoot aggregate, EntryState state) {
        Objects.requireNonNull(aggregate, "aggregate");

        int index = indexOf(aggregate);
        if (index < 0) {
            entries.add(new TrackedEntry(aggregate, state));
            return;
        }
        TrackedEntry existing = entries.get(index);
        entries.set(index, new TrackedEntry(aggregate, merge(existing.state(), state, aggregate)));
    }

    List<TrackedEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    List<AggregateRoot> aggregates() {
        return entries.stream()
            .map(TrackedEntry::aggregate)
            .toList();
    }

    void clear() {
        entries.clear();
    }

    private int indexOf(AggregateRoot aggregate) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).aggregate() == aggregate) {
                return i;
            }
        }
        return -1;
    }

    private static EntryState merge(EntryState current, EntryState requested, AggregateRoot aggregate) {
        if (requested == EntryState.DELETED) {
            return EntryState.DELETED;
        }
        if (current == EntryState.DELETED
            || (current == EntryState.MODIFIED && requested == EntryState.ADDED)) {
            throw new BusinessException(
                ErrorCode.INVALID_TRACKING_STATE,
                String.format("%s 상태의 애그리거트를 %s로 등록할 수 없습니다. aggregateId: %s",
                    current, requested, aggregate.getId())
            );
        }
        return current;
    }
}
