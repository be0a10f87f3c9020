package io.hhplus.shop.domain.customer;

import io.hhplus.shop.domain.readmodel.ReadModel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 고객 읽기 모델 (비정규화 조회 전용)
 *
 * 쓰기 트랜잭션과 무관하게 프로젝션 핸들러만 갱신한다.
 * 모든 필드를 이벤트에서 결정적으로 만들기 때문에 같은 이벤트를 다시 적용해도 결과가 같다.
 */
@Entity
@Table(name = "customer_read_model")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerReadModel implements ReadModel {

    @Id
    private UUID id;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(name = "full_name", nullable = false, length = 201)
    private String fullName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Gender gender;

    // 쓰기 모델과 달리 유니크 제약 없음: 프로젝션 순서와 무관하게 반영되어야 함
    @Column(nullable = false, length = 254)
    private String email;

    @Column(name = "date_of_birth", nullable = false)
    private LocalDate dateOfBirth;

    @Column(name = "last_event_at", nullable = false)
    private LocalDateTime lastEventAt;

    public static CustomerReadModel from(CustomerCreatedEvent event) {
        return of(event.id(), event.firstName(), event.lastName(), event.gender(),
            event.email(), event.dateOfBirth(), event.occurredAt());
    }

    public static CustomerReadModel from(CustomerUpdatedEvent event) {
        return of(event.id(), event.firstName(), event.lastName(), event.gender(),
            event.email(), event.dateOfBirth(), event.occurredAt());
    }

    private static CustomerReadModel of(UUID id, String firstName, String lastName, Gender gender,
                                        String email, LocalDate dateOfBirth, LocalDateTime occurredAt) {
        CustomerReadModel model = new CustomerReadModel();
        model.id = id;
        model.firstName = firstName;
        model.lastName = lastName;
        model.fullName = firstName + " " + lastName;
        model.gender = gender;
        model.email = email;
        model.dateOfBirth = dateOfBirth;
        model.lastEventAt = occurredAt;
        return model;
    }
}
