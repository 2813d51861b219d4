package com.ureca.loyalty.outbox.service;

import com.ureca.loyalty.outbox.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Outbox 상태 업데이트 전담
 * 각 업데이트는 REQUIRES_NEW 독립 트랜잭션
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxStatusUpdater {

    private final OutboxRepository outboxRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markAsPublished(Long outboxId) {
        int updated = outboxRepository.markAsPublished(outboxId, LocalDateTime.now());

        if (updated == 0) {
            log.debug("[Outbox] 이미 발행됨 또는 존재하지 않음. outboxId : {}", outboxId);
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markAsFailed(Long outboxId) {
        int updated = outboxRepository.markAsFailedAndIncrementRetry(outboxId);

        if (updated == 0) {
            log.warn("[Outbox] 발행 실패 기록 대상 없음. outboxId : {}", outboxId);
        } else {
            log.warn("[Outbox] 발행 실패 기록 완료. outboxId : {}", outboxId);
        }
    }
}
