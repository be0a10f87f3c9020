package io.hhplus.shop.application.customer.dto;

import io.hhplus.shop.domain.customer.Gender;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CreateCustomerRequest(
    @NotBlank(message = "이름은 필수입니다")
    @Size(max = 100, message = "이름은 100자를 넘을 수 없습니다")
    String firstName,

    @NotBlank(message = "성은 필수입니다")
    @Size(max = 100, message = "성은 100자를 넘을 수 없습니다")
    String lastName,

    @NotNull(message = "성별은 필수입니다")
    Gender gender,

    @NotBlank(message = "이메일은 필수입니다")
    @Email(message = "올바른 이메일 형식이 아닙니다")
    String email,

    @NotNull(message = "생년월일은 필수입니다")
    @Past(message = "생년월일은 과거 날짜여야 합니다")
    LocalDate dateOfBirth
) {
}
