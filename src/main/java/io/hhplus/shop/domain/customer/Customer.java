package io.hhplus.shop.domain.customer;

import io.hhplus.shop.common.exception.BusinessException;
import io.hhplus.shop.common.exception.ErrorCode;
import io.hhplus.shop.domain.common.AggregateRoot;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 고객 애그리거트 (쓰기 모델)
 *
 * 상태 변경마다 변경 후 전체 스냅샷을 담은 이벤트를 발생시킨다.
 * 이메일은 고객 간에 유일하다 (uk_customers_email).
 */
@Entity
@Table(
    name = "customers",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_customers_email", columnNames = "email")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Customer extends AggregateRoot {

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Gender gender;

    @Column(nullable = false, length = 254)
    private String email;

    @Column(name = "date_of_birth", nullable = false)
    private LocalDate dateOfBirth;

    private Customer(UUID id, String firstName, String lastName, Gender gender,
                     String email, LocalDate dateOfBirth) {
        super(id);
        this.firstName = firstName;
        this.lastName = lastName;
        this.gender = gender;
        this.email = email;
        this.dateOfBirth = dateOfBirth;
    }

    public static Customer create(String firstName, String lastName, Gender gender,
                                  String email, LocalDate dateOfBirth) {
        return create(UUID.randomUUID(), firstName, lastName, gender, email, dateOfBirth);
    }

    public static Customer create(UUID id, String firstName, String lastName, Gender gender,
                                  String email, LocalDate dateOfBirth) {
        validateName(firstName, "이름");
        validateName(lastName, "성");
        validateEmail(email);
        if (gender == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "성별은 필수입니다");
        }
        validateDateOfBirth(dateOfBirth);

        Customer customer = new Customer(id, firstName.trim(), lastName.trim(), gender,
            normalizeEmail(email), dateOfBirth);
        customer.addDomainEvent(CustomerCreatedEvent.from(customer, LocalDateTime.now()));
        return customer;
    }

    public void changeEmail(String newEmail) {
        validateEmail(newEmail);

        this.email = normalizeEmail(newEmail);
        addDomainEvent(CustomerUpdatedEvent.from(this, LocalDateTime.now()));
    }

    public void delete() {
        addDomainEvent(CustomerDeletedEvent.from(this, LocalDateTime.now()));
    }

    public String getFullName() {
        return firstName + " " + lastName;
    }

    /**
     * 이메일 비교/저장 기준 (앞뒤 공백 제거, 소문자)
     */
    public static String normalizeEmail(String email) {
        return email.trim().toLowerCase();
    }

    private static void validateName(String name, String field) {
        if (name == null || name.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, field + "은(는) 필수입니다");
        }
        if (name.trim().length() > 100) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, field + "은(는) 100자를 넘을 수 없습니다");
        }
    }

    private static void validateEmail(String email) {
        if (email == null || email.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "이메일은 필수입니다");
        }
        if (!email.contains("@")) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "올바른 이메일 형식이 아닙니다");
        }
    }

    private static void validateDateOfBirth(LocalDate dateOfBirth) {
        if (dateOfBirth == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "생년월일은 필수입니다");
        }
        if (dateOfBirth.isAfter(LocalDate.now())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "생년월일은 미래일 수 없습니다");
        }
    }
}
