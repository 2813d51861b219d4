package com.ureca.loyalty.outbox.scheduler;

import com.ureca.loyalty.common.notification.LoyaltyAlertService;
import com.ureca.loyalty.outbox.dto.OutboxMessage;
import com.ureca.loyalty.outbox.entity.Outbox;
import com.ureca.loyalty.outbox.entity.OutboxStatus;
import com.ureca.loyalty.outbox.repository.OutboxRepository;
import com.ureca.loyalty.outbox.service.OutboxMessagePublisher;
import com.ureca.loyalty.outbox.service.OutboxStatusUpdater;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 등급 변경 이벤트 재발행
 * <p>
 * 대상: 즉시 발행에 실패한 SEND_FAIL, 커밋 후 즉시 발행 전에 서버가 내려가 남은 오래된 INIT
 * 재시도 한도에 닿은 이벤트는 더 이상 조회되지 않으므로 그 시점에 운영자 알림
 * 원장과 잔액은 건드리지 않는다
 */
@Slf4j
@Component
public class OutboxPollingScheduler {

    private final OutboxRepository outboxRepository;
    private final OutboxMessagePublisher messagePublisher;
    private final OutboxStatusUpdater statusUpdater;
    private final LoyaltyAlertService alertService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final int batchSize;
    private final int staleThresholdMinutes;
    private final int maxRetryCount;

    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);

    public OutboxPollingScheduler(
            OutboxRepository outboxRepository,
            OutboxMessagePublisher messagePublisher,
            OutboxStatusUpdater statusUpdater,
            LoyaltyAlertService alertService,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${outbox.publisher.batch-size}") int batchSize,
            @Value("${outbox.publisher.stale-threshold-minutes}") int staleThresholdMinutes,
            @Value("${outbox.publisher.max-retry}") int maxRetryCount
    ) {
        this.outboxRepository = outboxRepository;
        this.messagePublisher = messagePublisher;
        this.statusUpdater = statusUpdater;
        this.alertService = alertService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.batchSize = batchSize;
        this.staleThresholdMinutes = staleThresholdMinutes;
        this.maxRetryCount = maxRetryCount;
    }

    @PreDestroy
    public void shutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("[이벤트 재발행] 종료 요청. 진행 중인 배치까지만 처리");
        }
    }

    @Scheduled(cron = "${outbox.publisher.cron}")
    @SchedulerLock(name = "loyaltyOutboxRepublish", lockAtMostFor = "PT1M")
    public void scheduledRepublish() {
        republishPending();
    }

    /**
     * @return 이번 실행에서 발행에 성공한 이벤트 수
     */
    public int republishPending() {
        if (shutdownRequested.get()) {
            return 0;
        }

        LocalDateTime staleBefore = LocalDateTime.now(clock).minusMinutes(staleThresholdMinutes);
        List<Outbox> pending = outboxRepository.findPendingEvents(
                OutboxStatus.SEND_FAIL,
                OutboxStatus.INIT,
                staleBefore,
                maxRetryCount,
                PageRequest.of(0, batchSize)
        );

        if (pending.isEmpty()) {
            return 0;
        }

        log.info("[이벤트 재발행] 시작. 대상 : {}", pending.size());

        int published = 0;
        for (Outbox outbox : pending) {
            if (shutdownRequested.get()) {
                break;
            }
            if (republish(outbox)) {
                published++;
            }
        }

        log.info("[이벤트 재발행] 완료. 성공 : {}, 실패 : {}", published, pending.size() - published);
        return published;
    }

    private boolean republish(Outbox outbox) {
        try {
            messagePublisher.publish(OutboxMessage.from(outbox));
            statusUpdater.markAsPublished(outbox.getId());
            count("success");
            return true;

        } catch (Exception e) {
            statusUpdater.markAsFailed(outbox.getId());
            count("fail");

            int attempts = outbox.getRetryCount() + 1;
            log.error("[이벤트 재발행] 실패. outboxId : {}, memberId : {}, 시도 : {}/{}, error : {}",
                    outbox.getId(), outbox.getAggregateId(), attempts, maxRetryCount, e.getMessage());

            if (attempts >= maxRetryCount) {
                alertService.alertEventRetryExhausted(
                        outbox.getAggregateId(), outbox.getEventType(), outbox.getEventId(), e.getMessage());
            }
            return false;
        }
    }

    private void count(String result) {
        Counter.builder("outbox_events_published_total")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
