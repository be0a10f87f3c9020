package io.hhplus.shop.application.event;

import io.hhplus.shop.domain.common.AggregateType;
import io.hhplus.shop.domain.common.DomainEvent;
import io.hhplus.shop.domain.common.EventKind;

import java.util.Objects;

/**
 * 이벤트 라우팅 키: (애그리거트 타입, 이벤트 종류)
 */
public record EventRoute(AggregateType aggregateType, EventKind kind) {

    public EventRoute {
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(kind, "kind");
    }

    public static EventRoute of(DomainEvent event) {
        return new EventRoute(event.aggregateType(), event.kind());
    }

    @Override
    public String toString() {
        return aggregateType + "/" + kind;
    }
}
