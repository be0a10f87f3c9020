package io.hhplus.shop.domain.common;

/**
 * Unit of Work
 *
 * 한 번의 쓰기 저장소 커밋(재시도 포함)과 그로 인해 발생하는 이벤트 전파의 경계.
 *
 * <pre>
 * try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
 *     unitOfWork.add(customer);
 *     unitOfWork.commit();
 * }
 * </pre>
 *
 * 요청마다 새 인스턴스를 사용하며 스레드 간에 공유하지 않는다.
 */
public interface UnitOfWork extends AutoCloseable {

    /**
     * 신규 애그리거트 등록 (커밋 시 INSERT)
     */
    void add(AggregateRoot aggregate);

    /**
     * 변경된 애그리거트 등록 (커밋 시 UPDATE)
     */
    void update(AggregateRoot aggregate);

    /**
     * 삭제할 애그리거트 등록 (커밋 시 DELETE)
     */
    void remove(AggregateRoot aggregate);

    /**
     * 등록된 변경을 하나의 트랜잭션으로 커밋한 뒤, 수거한 이벤트를 저장하고 발행한다.
     *
     * @throws org.springframework.dao.DataAccessException 커밋 전 실패 (롤백됨)
     * @throws io.hhplus.shop.common.exception.BusinessException 커밋 후 이벤트 저장/발행 실패 (쓰기 저장소는 커밋됨)
     */
    void commit();

    /**
     * 추적 중인 변경을 버리고 이후 사용을 막는다.
     */
    @Override
    void close();
}
