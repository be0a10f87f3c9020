package io.hhplus.shop.infrastructure.persistence.unitofwork;

import io.hhplus.shop.domain.common.AggregateRoot;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 쓰기 저장소 (JPA)
 *
 * 호출자가 시작한 트랜잭션 안에서 추적된 변경을 적용하고 flush 한다.
 * 커밋 시도마다 새 영속성 컨텍스트에 다시 적용되므로 재시도해도 안전하다.
 *
 * flush 중 제약 조건 위반은 @Repository 예외 변환으로
 * DataIntegrityViolationException 이 된다.
 */
@Slf4j
@Repository
public class JpaWriteStore {

    @PersistenceContext
    private EntityManager entityManager;

    /**
     * @return 적용된 애그리거트 수 (이미 없는 애그리거트 삭제는 제외)
     */
    public int saveChanges(List<TrackedEntry> entries) {
        int affected = 0;
        for (TrackedEntry entry : entries) {
            AggregateRoot aggregate = entry.aggregate();
            switch (entry.state()) {
                case ADDED -> {
                    entityManager.persist(aggregate);
                    affected++;
                }
                case MODIFIED -> {
                    entityManager.merge(aggregate);
                    affected++;
                }
                case DELETED -> {
                    AggregateRoot managed = entityManager.find(aggregate.getClass(), aggregate.getId());
                    if (managed == null) {
                        log.debug("삭제 대상이 이미 없음: type={}, id={}",
                            aggregate.getClass().getSimpleName(), aggregate.getId());
                        continue;
                    }
                    entityManager.remove(managed);
                    affected++;
                }
            }
        }
        entityManager.flush();
        return affected;
    }
}
