package io.hhplus.shop.application.event;

import io.hhplus.shop.domain.common.AggregateType;
import io.hhplus.shop.domain.common.DomainEvent;
import io.hhplus.shop.domain.common.EventKind;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 이벤트 핸들러 조회 테이블
 *
 * (애그리거트 타입, 이벤트 종류) 별로 핸들러를 등록 순서대로 보관한다.
 * 런타임 타입 검사 없이 라우팅 키만으로 핸들러를 찾는다.
 *
 * <pre>{@code
 * registry
 *     .register(AggregateType.CUSTOMER, EventKind.CREATED, CustomerCreatedEvent.class, this::onCreated)
 *     .register(AggregateType.CUSTOMER, EventKind.DELETED, CustomerDeletedEvent.class, this::onDeleted);
 * }</pre>
 *
 * 등록과 조회는 동시에 호출되어도 안전하다.
 */
public class EventHandlerRegistry {

    private final Map<EventRoute, CopyOnWriteArrayList<EventHandler>> handlers = new ConcurrentHashMap<>();

    public EventHandlerRegistry register(EventRoute route, EventHandler handler) {
        handlers.computeIfAbsent(route, ignored -> new CopyOnWriteArrayList<>()).add(handler);
        return this;
    }

    /**
     * 라우팅 키에 해당하는 이벤트 타입으로 변환해 전달하는 핸들러를 등록한다.
     */
    public <E extends DomainEvent> EventHandlerRegistry register(AggregateType aggregateType,
                                                                 EventKind kind,
                                                                 Class<E> eventType,
                                                                 Consumer<? super E> handler) {
        return register(new EventRoute(aggregateType, kind), event -> handler.accept(eventType.cast(event)));
    }

    public List<EventHandler> handlersFor(EventRoute route) {
        List<EventHandler> registered = handlers.get(route);
        if (registered == null) {
            return List.of();
        }
        return Collections.unmodifiableList(registered);
    }

    public Set<EventRoute> routes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
