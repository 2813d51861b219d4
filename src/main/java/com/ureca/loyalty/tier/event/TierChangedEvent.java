package com.ureca.loyalty.tier.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ureca.loyalty.common.event.AggregateType;
import com.ureca.loyalty.common.event.DomainEvent;
import com.ureca.loyalty.common.event.EventType;

import java.time.LocalDateTime;

/**
 * 회원 등급 변경 이벤트
 * 알림, 등급 혜택 등 외부 소비자용 (Outbox -> loyalty.exchange)
 */
public record TierChangedEvent(
        Long memberId,
        String oldTier,
        String newTier,
        long balance,
        LocalDateTime changedAt
) implements DomainEvent {

    @JsonIgnore
    @Override
    public Long getAggregateId() {
        return memberId;
    }

    @JsonIgnore
    @Override
    public AggregateType getAggregateType() {
        return AggregateType.LOYALTY;
    }

    @JsonIgnore
    @Override
    public EventType getEventType() {
        return EventType.TIER_CHANGED;
    }
}
