package io.hhplus.shop.application.event;

import io.hhplus.shop.domain.common.DomainEvent;

@FunctionalInterface
public interface EventHandler {

    void handle(DomainEvent event);
}
