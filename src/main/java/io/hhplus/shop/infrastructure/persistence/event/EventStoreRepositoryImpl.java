package io.hhplus.shop.infrastructure.persistence.event;

import io.hhplus.shop.domain.event.EventStoreRepository;
import io.hhplus.shop.domain.event.StoredEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * 이벤트 저장소 구현
 *
 * 레코드마다 save() 를 호출하므로 각 레코드가 독립된 짧은 트랜잭션으로 기록된다.
 * 중간에 실패하면 그 앞까지는 남는다 (재조정 대상).
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EventStoreRepositoryImpl implements EventStoreRepository {

    private final EventStoreJpaRepository jpaRepository;

    @Override
    public void store(List<StoredEvent> records) {
        for (StoredEvent record : records) {
            jpaRepository.save(record);
        }
        log.debug("이벤트 저장소 기록 완료: records={}", records.size());
    }

    @Override
    public List<StoredEvent> findByAggregateId(UUID aggregateId) {
        return jpaRepository.findByAggregateIdOrderByIdAsc(aggregateId);
    }

    @Override
    public long count() {
        return jpaRepository.count();
    }
}
