package io.hhplus.shop.config;

import io.hhplus.shop.application.event.EventHandlerRegistry;
import io.hhplus.shop.application.projection.ProjectionHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 이벤트 라우팅 테이블 구성
 *
 * 등록된 모든 ProjectionHandler 빈이 (애그리거트 타입, 이벤트 종류) 조합별로
 * 자신의 핸들러를 레지스트리에 등록한다.
 */
@Configuration
@Slf4j
public class EventHandlerConfig {

    @Bean
    public EventHandlerRegistry eventHandlerRegistry(List<ProjectionHandler> projectionHandlers) {
        EventHandlerRegistry registry = new EventHandlerRegistry();
        projectionHandlers.forEach(handler -> handler.registerRoutes(registry));

        log.info("이벤트 핸들러 등록 완료: projectionHandlers={}, routes={}",
            projectionHandlers.size(), registry.routes());
        return registry;
    }
}
