package io.hhplus.shop.infrastructure.persistence.readmodel;

import io.hhplus.shop.domain.readmodel.ReadModel;
import io.hhplus.shop.domain.readmodel.ReadModelStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 읽기 저장소 (JPA)
 *
 * customer_read_model / product_read_model 테이블. 호출마다 자체 트랜잭션으로 동작하며
 * 쓰기 모델 트랜잭션에는 참여하지 않는다.
 */
@Repository
@Transactional
public class JpaReadModelStore implements ReadModelStore {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public <T extends ReadModel> void upsert(T readModel) {
        // merge: 있으면 전체 교체(UPDATE), 없으면 INSERT
        entityManager.merge(readModel);
    }

    @Override
    public <T extends ReadModel> void deleteById(Class<T> type, UUID id) {
        T existing = entityManager.find(type, id);
        if (existing != null) {
            entityManager.remove(existing);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public <T extends ReadModel> Optional<T> findById(Class<T> type, UUID id) {
        return Optional.ofNullable(entityManager.find(type, id));
    }

    @Override
    @Transactional(readOnly = true)
    public <T extends ReadModel> List<T> findAll(Class<T> type) {
        CriteriaBuilder builder = entityManager.getCriteriaBuilder();
        CriteriaQuery<T> query = builder.createQuery(type);
        query.select(query.from(type));
        return entityManager.createQuery(query).getResultList();
    }
}
