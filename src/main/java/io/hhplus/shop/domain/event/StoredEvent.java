package io.hhplus.shop.domain.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 이벤트 저장소 레코드 (Append-only)
 *
 * 커밋된 쓰기 트랜잭션에서 수거한 도메인 이벤트 1건당 1레코드.
 * 커밋되지 않은 트랜잭션의 이벤트는 절대 기록되지 않는다.
 */
@Entity
@Table(name = "event_store", indexes = {
    @Index(name = "idx_event_store_aggregate_id", columnList = "aggregate_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StoredEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    /**
     * 이벤트 타입 (예: "CustomerCreatedEvent")
     */
    @Column(name = "message_type", nullable = false, length = 100)
    private String messageType;

    /**
     * 이벤트 페이로드 (JSON 형식)
     */
    @Column(nullable = false, columnDefinition = "TEXT")
    private String data;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    public static StoredEvent of(UUID aggregateId, String messageType, String data, LocalDateTime occurredAt) {
        StoredEvent event = new StoredEvent();
        event.aggregateId = aggregateId;
        event.messageType = messageType;
        event.data = data;
        event.occurredAt = occurredAt;
        return event;
    }
}
