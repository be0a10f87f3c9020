package io.hhplus.shop.infrastructure.persistence.unitofwork;

public enum EntryState {
    ADDED,
    MODIFIED,
    DELETED
}
