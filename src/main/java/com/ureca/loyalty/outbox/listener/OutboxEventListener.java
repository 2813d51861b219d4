package com.ureca.loyalty.outbox.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.loyalty.common.event.DomainEvent;
import com.ureca.loyalty.outbox.entity.Outbox;
import com.ureca.loyalty.outbox.event.OutboxScheduledEvent;
import com.ureca.loyalty.outbox.exception.OutboxSerializationException;
import com.ureca.loyalty.outbox.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 도메인 이벤트를 Outbox 테이블에 저장하는 리스너
 * BEFORE_COMMIT 에서 실행되어 원장 기록과 같은 트랜잭션으로 커밋된다
 * 저장 후 즉시 발행용 OutboxScheduledEvent 를 이어서 발행
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventListener {

    private final OutboxRepository outboxRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    /**
     * @param event 도메인 이벤트
     * @throws OutboxSerializationException 직렬화 실패 시 (전체 트랜잭션 롤백)
     */
    @TransactionalEventListener(phase = TransactionPhase.BEFORE_COMMIT)
    public void saveToOutbox(DomainEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("[Outbox] JSON 직렬화 실패. 전체 트랜잭션 롤백. eventType : {}, aggregateId : {}",
                    event.getEventType().getTypeName(), event.getAggregateId(), e);

            throw new OutboxSerializationException(
                    "이벤트 직렬화 실패: " + event.getEventType().getTypeName(), e
            );
        }

        Outbox outbox = outboxRepository.save(Outbox.create(
                event.getEventType(),
                event.getAggregateType(),
                event.getAggregateId(),
                payload
        ));

        log.info("[Outbox] 이벤트 저장 완료. outboxId : {}, eventType : {}, aggregateId : {}",
                outbox.getId(), outbox.getEventType(), outbox.getAggregateId());

        eventPublisher.publishEvent(new OutboxScheduledEvent(
                outbox.getId(),
                outbox.getEventId(),
                outbox.getEventType(),
                outbox.getAggregateType(),
                outbox.getAggregateId(),
                payload
        ));
    }
}
