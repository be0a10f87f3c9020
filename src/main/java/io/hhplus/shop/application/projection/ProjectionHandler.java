package io.hhplus.shop.application.projection;

import io.hhplus.shop.application.event.EventHandlerRegistry;

/**
 * 읽기 모델 프로젝션 핸들러
 *
 * 애그리거트 타입당 하나. 시작 시 자신이 처리하는 이벤트 라우트를 레지스트리에 등록한다.
 * 같은 이벤트가 다시 전달되어도 결과가 같아야 한다 (멱등).
 */
public interface ProjectionHandler {

    void registerRoutes(EventHandlerRegistry registry);
}
