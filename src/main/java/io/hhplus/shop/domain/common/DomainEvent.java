package io.hhplus.shop.domain.common;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 도메인 이벤트 마커 인터페이스
 *
 * 애그리거트 상태 변경 시점에 기록되는 불변 사실.
 * (aggregateType, kind) 조합이 이벤트 라우팅 키가 된다.
 */
public interface DomainEvent {

    UUID aggregateId();

    AggregateType aggregateType();

    EventKind kind();

    LocalDateTime occurredAt();

    /**
     * 이벤트 저장소의 message_type 및 로그에 쓰이는 이벤트 이름
     */
    default String eventName() {
        return getClass().getSimpleName();
    }
}
