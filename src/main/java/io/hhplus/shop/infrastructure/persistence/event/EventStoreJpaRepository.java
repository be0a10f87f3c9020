package io.hhplus.shop.infrastructure.persistence.event;

import io.hhplus.shop.domain.event.StoredEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface EventStoreJpaRepository extends JpaRepository<StoredEvent, Long> {

    List<StoredEvent> findByAggregateIdOrderByIdAsc(UUID aggregateId);
}
