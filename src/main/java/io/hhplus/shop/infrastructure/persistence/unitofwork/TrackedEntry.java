package io.hhplus.shop.infrastructure.persistence.unitofwork;

import io.hhplus.shop.domain.common.AggregateRoot;

public record TrackedEntry(AggregateRoot aggregate, EntryState state) {
}
