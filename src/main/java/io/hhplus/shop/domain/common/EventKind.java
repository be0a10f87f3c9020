package io.hhplus.shop.domain.common;

public enum EventKind {
    CREATED,
    UPDATED,
    DELETED
}
