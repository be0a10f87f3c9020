package io.hhplus.shop.infrastructure.event;

import io.hhplus.shop.application.event.DomainEventPublisher;
import io.hhplus.shop.application.event.EventHandler;
import io.hhplus.shop.application.event.EventHandlerRegistry;
import io.hhplus.shop.application.event.EventRoute;
import io.hhplus.shop.common.exception.BusinessException;
import io.hhplus.shop.common.exception.ErrorCode;
import io.hhplus.shop.domain.common.DomainEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 도메인 이벤트 디스패처 (fan-out + barrier)
 *
 * 동작:
 * - 이벤트를 애그리거트별 스트림으로 묶어 스트림마다 하나의 작업으로 실행
 * - 서로 다른 애그리거트는 eventDispatchExecutor 에서 동시에 처리
 * - 한 애그리거트의 이벤트는 발생 순서대로 적용 (읽기 모델이 항상 스트림의 앞부분을 반영)
 * - 스트림 안에서 이벤트 처리가 실패하면 그 스트림의 나머지 이벤트는 적용하지 않음
 *
 * 모든 작업이 끝날 때까지 기다린 뒤, 실패가 있으면 첫 번째 실패를 cause 로,
 * 나머지를 suppressed 로 담아 EVENT_DISPATCH_FAILED 를 던진다.
 * 이미 성공한 핸들러의 결과는 되돌리지 않는다.
 */
@Slf4j
@Component
public class ConcurrentDomainEventDispatcher implements DomainEventPublisher {

    private final EventHandlerRegistry registry;
    private final Executor executor;

    public ConcurrentDomainEventDispatcher(EventHandlerRegistry registry,
                                           @Qualifier("eventDispatchExecutor") Executor executor) {
        this.registry = registry;
        this.executor = executor;
    }

    @Override
    public void publish(List<? extends DomainEvent> events) {
        if (events.isEmpty()) {
            return;
        }

        List<CompletableFuture<List<RuntimeException>>> tasks = groupByAggregate(events).values().stream()
            .map(stream -> CompletableFuture.supplyAsync(() -> dispatchStream(stream), executor))
            .toList();

        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

        List<RuntimeException> failures = tasks.stream()
            .flatMap(task -> task.join().stream())
            .toList();

        if (!failures.isEmpty()) {
            BusinessException exception = new BusinessException(
                ErrorCode.EVENT_DISPATCH_FAILED,
                String.format("이벤트 핸들러 처리 실패: events=%d, failures=%d", events.size(), failures.size()),
                failures.get(0)
            );
            failures.stream().skip(1).forEach(exception::addSuppressed);
            throw exception;
        }
    }

    private Map<UUID, List<DomainEvent>> groupByAggregate(List<? extends DomainEvent> events) {
        Map<UUID, List<DomainEvent>> streams = new LinkedHashMap<>();
        for (DomainEvent event : events) {
            streams.computeIfAbsent(event.aggregateId(), ignored -> new ArrayList<>()).add(event);
        }
        return streams;
    }

    /**
     * 한 애그리거트의 이벤트를 순서대로 처리한다. 예외를 던지지 않고 실패 목록을 반환한다.
     */
    private List<RuntimeException> dispatchStream(List<DomainEvent> stream) {
        List<RuntimeException> failures = new ArrayList<>();

        for (int i = 0; i < stream.size(); i++) {
            DomainEvent event = stream.get(i);
            EventRoute route = EventRoute.of(event);
            List<EventHandler> handlers = registry.handlersFor(route);
            if (handlers.isEmpty()) {
                log.debug("등록된 핸들러 없음: route={}, event={}", route, event.eventName());
                continue;
            }

            int failuresBefore = failures.size();
            for (EventHandler handler : handlers) {
                try {
                    handler.handle(event);
                } catch (RuntimeException e) {
                    log.error("이벤트 핸들러 실패: route={}, aggregateId={}", route, event.aggregateId(), e);
                    failures.add(e);
                }
            }

            if (failures.size() > failuresBefore) {
                int skipped = stream.size() - i - 1;
                if (skipped > 0) {
                    log.warn("이벤트 처리 실패로 이후 이벤트 적용 중단: aggregateId={}, skipped={}",
                        event.aggregateId(), skipped);
                }
                break;
            }
        }
        return failures;
    }
}
