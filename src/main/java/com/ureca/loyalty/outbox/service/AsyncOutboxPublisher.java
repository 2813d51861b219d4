package com.ureca.loyalty.outbox.service;

import com.ureca.loyalty.config.AsyncConfig;
import com.ureca.loyalty.outbox.dto.OutboxMessage;
import com.ureca.loyalty.outbox.event.OutboxScheduledEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 커밋 직후 Outbox 이벤트 즉시 발행
 * 원장 요청 스레드와 분리된 이벤트 Executor 에서 실행되므로
 * 브로커 장애가 포인트 적립/사용 응답에 영향을 주지 않는다
 * 실패 시 SEND_FAIL 로 남겨 OutboxPollingScheduler 가 재시도
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AsyncOutboxPublisher {

    private final OutboxMessagePublisher messagePublisher;
    private final OutboxStatusUpdater statusUpdater;
    private final MeterRegistry meterRegistry;

    @Async(AsyncConfig.EVENT_EXECUTOR_NAME)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void pushImmediately(OutboxScheduledEvent event) {
        try {
            messagePublisher.publish(OutboxMessage.from(event));

            statusUpdater.markAsPublished(event.outboxId());
            increment("success");

            log.info("[Outbox 즉시 발행] 발행 완료. outboxId : {}, eventType : {}, aggregateId : {}",
                    event.outboxId(), event.eventType(), event.aggregateId());

        } catch (Exception e) {
            log.error("[Outbox 즉시 발행] 발행 실패. 스케줄러 재시도 대상. outboxId : {}, error : {}",
                    event.outboxId(), e.getMessage());

            statusUpdater.markAsFailed(event.outboxId());
            increment("fail");
        }
    }

    private void increment(String result) {
        Counter.builder("outbox_events_published_total")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
