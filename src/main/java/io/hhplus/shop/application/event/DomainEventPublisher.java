package io.hhplus.shop.application.event;

import io.hhplus.shop.domain.common.DomainEvent;

import java.util.List;

/**
 * 도메인 이벤트 발행 포트
 */
public interface DomainEventPublisher {

    /**
     * 등록된 모든 핸들러 호출이 끝날 때까지 기다린 뒤 반환한다.
     * 하나라도 실패하면 모든 호출이 끝난 후 실패를 보고한다.
     *
     * @throws io.hhplus.shop.common.exception.BusinessException EVENT_DISPATCH_FAILED
     */
    void publish(List<? extends DomainEvent> events);
}
