package io.hhplus.shop.domain.customer;

import io.hhplus.shop.common.exception.BusinessException;
import io.hhplus.shop.common.exception.ErrorCode;

import java.util.Optional;
import java.util.UUID;

/**
 * 고객 쓰기 모델 조회 포트
 *
 * 저장/삭제는 UnitOfWork를 통해서만 수행한다.
 */
public interface CustomerRepository {

    Optional<Customer> findById(UUID id);

    boolean existsByEmail(String email);

    default Customer findByIdOrThrow(UUID id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.CUSTOMER_NOT_FOUND,
                "고객을 찾을 수 없습니다. customerId: " + id
            ));
    }
}
