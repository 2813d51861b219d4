package com.ureca.loyalty.outbox.entity;

import com.ureca.loyalty.common.BaseTimeEntity;
import com.ureca.loyalty.common.event.AggregateType;
import com.ureca.loyalty.common.event.EventType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 포인트 도메인 이벤트 발행 대기열
 * 원장 기록과 같은 트랜잭션에서 저장되고 커밋 이후 RabbitMQ 로 발행된다
 */
@Entity
@Table(
        name = "outbox",
        indexes = {
                @Index(name = "idx_outbox_status_created", columnList = "status, created_at"),
                @Index(name = "idx_outbox_status_retry", columnList = "status, retry_count"),
                @Index(name = "idx_outbox_aggregate", columnList = "aggregate_type, aggregate_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Outbox extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "outbox_id")
    private Long id;

    @Column(name = "event_id", nullable = false, unique = true, length = 36)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private Long aggregateId;

    @Lob
    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OutboxStatus status;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Builder
    private Outbox(String eventId, String eventType, String aggregateType,
                   Long aggregateId, String payload, OutboxStatus status, Integer retryCount) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.payload = payload;
        this.status = status;
        this.retryCount = retryCount;
    }

    public static Outbox create(
            EventType eventType,
            AggregateType aggregateType,
            Long aggregateId,
            String payload
    ) {
        return Outbox.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType.getTypeName())
                .aggregateType(aggregateType.getTypeName())
                .aggregateId(aggregateId)
                .payload(payload)
                .status(OutboxStatus.INIT)
                .retryCount(0)
                .build();
    }
}
