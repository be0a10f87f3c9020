package io.hhplus.shop.application.customer.dto;

import io.hhplus.shop.domain.customer.CustomerReadModel;
import io.hhplus.shop.domain.customer.Gender;

import java.time.LocalDate;
import java.util.UUID;

/**
 * 고객 조회 응답 (읽기 모델 기준)
 */
public record CustomerResponse(
    UUID id,
    String firstName,
    String lastName,
    String fullName,
    Gender gender,
    String email,
    LocalDate dateOfBirth
) {
    public static CustomerResponse from(CustomerReadModel readModel) {
        return new CustomerResponse(
            readModel.getId(),
            readModel.getFirstName(),
            readModel.getLastName(),
            readModel.getFullName(),
            readModel.getGender(),
            readModel.getEmail(),
            readModel.getDateOfBirth()
        );
    }
}
