package com.ureca.loyalty.outbox.event;

/**
 * BEFORE_COMMIT 에 저장된 Outbox 정보를 AFTER_COMMIT 즉시 발행기로 넘기는 내부 DTO
 */
public record OutboxScheduledEvent(
        Long outboxId,
        String eventId,        // 소비자 멱등성 검증용
        String eventType,      // 라우팅 키 결정
        String aggregateType,  // exchange 결정
        Long aggregateId,      // memberId
        String payload         // 직렬화된 JSON
) {
}
