package io.hhplus.shop.domain.readmodel;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 읽기 저장소 포트
 *
 * 쓰기 저장소 트랜잭션과 독립적으로 동작한다 (최종적 일관성).
 */
public interface ReadModelStore {

    /**
     * 같은 id의 레코드가 있으면 전체를 교체하고, 없으면 추가한다.
     */
    <T extends ReadModel> void upsert(T readModel);

    /**
     * id로 삭제한다. 없으면 아무 일도 하지 않는다.
     */
    <T extends ReadModel> void deleteById(Class<T> type, UUID id);

    <T extends ReadModel> Optional<T> findById(Class<T> type, UUID id);

    <T extends ReadModel> List<T> findAll(Class<T> type);
}
