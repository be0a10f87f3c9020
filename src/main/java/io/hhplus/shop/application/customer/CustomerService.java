package io.hhplus.shop.application.customer;

import io.hhplus.shop.application.customer.dto.CreateCustomerRequest;
import io.hhplus.shop.application.customer.dto.CreateCustomerResponse;
import io.hhplus.shop.application.customer.dto.UpdateCustomerRequest;
import io.hhplus.shop.common.exception.BusinessException;
import io.hhplus.shop.common.exception.ErrorCode;
import io.hhplus.shop.domain.common.UnitOfWork;
import io.hhplus.shop.domain.common.UnitOfWorkFactory;
import io.hhplus.shop.domain.customer.Customer;
import io.hhplus.shop.domain.customer.CustomerRepository;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.UUID;

/**
 * 고객 쓰기 서비스
 *
 * 흐름: 애그리거트 변경 → UnitOfWork 등록 → commit()
 * commit() 이후 이벤트 저장/발행은 UnitOfWork가 담당한다.
 *
 * 이메일 중복은 여기서 먼저 확인하고, 동시 요청은 uk_customers_email 제약이 막는다.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class CustomerService {

    private final UnitOfWorkFactory unitOfWorkFactory;
    private final CustomerRepository customerRepository;

    public CreateCustomerResponse create(@Valid CreateCustomerRequest request) {
        validateEmailNotTaken(request.email());

        Customer customer = Customer.create(
            request.firstName(),
            request.lastName(),
            request.gender(),
            request.email(),
            request.dateOfBirth()
        );

        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.add(customer);
            unitOfWork.commit();
        }

        log.info("고객 생성 완료: customerId={}", customer.getId());
        return CreateCustomerResponse.from(customer);
    }

    public void updateEmail(UUID customerId, @Valid UpdateCustomerRequest request) {
        Customer customer = customerRepository.findByIdOrThrow(customerId);
        if (customer.getEmail().equals(Customer.normalizeEmail(request.email()))) {
            log.debug("이메일 변경 없음: customerId={}", customerId);
            return;
        }
        validateEmailNotTaken(request.email());

        customer.changeEmail(request.email());

        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.update(customer);
            unitOfWork.commit();
        }

        log.info("고객 이메일 변경 완료: customerId={}", customerId);
    }

    public void delete(UUID customerId) {
        Customer customer = customerRepository.findByIdOrThrow(customerId);
        customer.delete();

        try (UnitOfWork unitOfWork = unitOfWorkFactory.open()) {
            unitOfWork.remove(customer);
            unitOfWork.commit();
        }

        log.info("고객 삭제 완료: customerId={}", customerId);
    }

    private void validateEmailNotTaken(String email) {
        if (email != null && customerRepository.existsByEmail(Customer.normalizeEmail(email))) {
            throw new BusinessException(
                ErrorCode.DUPLICATE_EMAIL,
                "이미 사용 중인 이메일입니다. email: " + email
            );
        }
    }
}
