package io.hhplus.shop.domain.event;

import java.util.List;
import java.util.UUID;

/**
 * 이벤트 저장소 인터페이스
 */
public interface EventStoreRepository {

    /**
     * 레코드를 순서대로 한 건씩 기록한다.
     *
     * 내부 재시도 없음. 중간에 실패하면 앞부분만 기록된 채로 예외가 전파될 수 있다.
     */
    void store(List<StoredEvent> records);

    /**
     * 애그리거트의 이벤트 스트림 조회 (기록 순서)
     */
    List<StoredEvent> findByAggregateId(UUID aggregateId);

    long count();
}
