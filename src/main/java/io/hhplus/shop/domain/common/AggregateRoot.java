package io.hhplus.shop.domain.common;

import jakarta.persistence.Column;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.Transient;
import lombok.Getter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 애그리거트 루트
 *
 * 쓰기 모델의 일관성 경계. 상태를 변경하는 메서드는 변경 사실을 도메인 이벤트로
 * 대기열에 쌓고, Unit of Work 커밋 시 DomainEventCapture가 대기열을 수거한다.
 *
 * <ul>
 *   <li>식별자(UUID)는 애플리케이션이 생성 시점에 부여한다.</li>
 *   <li>대기 이벤트 목록은 영속화되지 않는다 (@Transient).</li>
 *   <li>대기열은 한 번의 커밋 시도 동안 이 인스턴스만 소유한다.</li>
 *   <li>created_at / updated_at 은 JPA Auditing 으로 채운다.</li>
 * </ul>
 */
@Getter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class AggregateRoot {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Transient
    private final List<DomainEvent> domainEvents = new ArrayList<>();

    protected AggregateRoot() {
    }

    protected AggregateRoot(UUID id) {
        this.id = id;
    }

    protected void addDomainEvent(DomainEvent event) {
        domainEvents.add(event);
    }

    /**
     * 대기 중인 이벤트 (읽기 전용 뷰, 발생 순서 유지)
     */
    public List<DomainEvent> getDomainEvents() {
        return Collections.unmodifiableList(domainEvents);
    }

    public boolean hasDomainEvents() {
        return !domainEvents.isEmpty();
    }

    public void clearDomainEvents() {
        domainEvents.clear();
    }

    /**
     * 롤백된 커밋 시도에서 수거했던 이벤트를 대기열 앞쪽에 되돌린다.
     * 이후 추가된 이벤트보다 먼저 발생한 이벤트이므로 순서를 보존한다.
     */
    public void restoreDomainEvents(List<? extends DomainEvent> events) {
        domainEvents.addAll(0, events);
    }
}
