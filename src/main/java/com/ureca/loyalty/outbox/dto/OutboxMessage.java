package com.ureca.loyalty.outbox.dto;

import com.ureca.loyalty.common.event.AggregateType;
import com.ureca.loyalty.common.event.EventType;
import com.ureca.loyalty.outbox.entity.Outbox;
import com.ureca.loyalty.outbox.event.OutboxScheduledEvent;

/**
 * 브로커로 나가는 포인트 도메인 이벤트 한 건
 * 즉시 발행(커밋 직후)과 재발행(Outbox 행) 모두 이 형태로 OutboxMessagePublisher 에 넘긴다
 * 저장된 타입 문자열을 모르면 UnknownEventTypeException / UnknownAggregateTypeException
 */
public record OutboxMessage(
        Long outboxId,
        String eventId,
        EventType eventType,
        AggregateType aggregateType,
        Long memberId,
        String payload
) {
    public static OutboxMessage from(Outbox outbox) {
        return new OutboxMessage(
                outbox.getId(),
                outbox.getEventId(),
                EventType.from(outbox.getEventType()),
                AggregateType.from(outbox.getAggregateType()),
                outbox.getAggregateId(),
                outbox.getPayload()
        );
    }

    public static OutboxMessage from(OutboxScheduledEvent event) {
        return new OutboxMessage(
                event.outboxId(),
                event.eventId(),
                EventType.from(event.eventType()),
                AggregateType.from(event.aggregateType()),
                event.aggregateId(),
                event.payload()
        );
    }
}
