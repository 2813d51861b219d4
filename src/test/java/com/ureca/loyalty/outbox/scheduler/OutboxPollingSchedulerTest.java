package com.ureca.loyalty.outbox.scheduler;

import com.ureca.loyalty.common.event.AggregateType;
import com.ureca.loyalty.common.event.EventType;
import com.ureca.loyalty.common.notification.LoyaltyAlertService;
import com.ureca.loyalty.outbox.dto.OutboxMessage;
import com.ureca.loyalty.outbox.entity.Outbox;
import com.ureca.loyalty.outbox.entity.OutboxStatus;
import com.ureca.loyalty.outbox.repository.OutboxRepository;
import com.ureca.loyalty.outbox.service.OutboxMessagePublisher;
import com.ureca.loyalty.outbox.service.OutboxStatusUpdater;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static com.ureca.loyalty.support.TestReflectionUtils.setField;
import static com.ureca.loyalty.support.fixture.LedgerFixture.BASE_TIME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxPollingScheduler 단위 테스트")
class OutboxPollingSchedulerTest {

    private static final int MAX_RETRY = 5;
    private static final int STALE_MINUTES = 5;

    @Mock
    private OutboxRepository outboxRepository;

    @Mock
    private OutboxMessagePublisher messagePublisher;

    @Mock
    private OutboxStatusUpdater statusUpdater;

    @Mock
    private LoyaltyAlertService alertService;

    private SimpleMeterRegistry meterRegistry;
    private OutboxPollingScheduler scheduler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(BASE_TIME.atZone(ZoneId.systemDefault()).toInstant(), ZoneId.systemDefault());
        scheduler = new OutboxPollingScheduler(
                outboxRepository, messagePublisher, statusUpdater, alertService,
                meterRegistry, clock, 100, STALE_MINUTES, MAX_RETRY);
    }

    private Outbox tierChanged(Long id, Long memberId, int retryCount) {
        Outbox outbox = Outbox.create(EventType.TIER_CHANGED, AggregateType.LOYALTY, memberId,
                "{\"memberId\":" + memberId + ",\"oldTier\":\"Bronze\",\"newTier\":\"Silver\"}");
        setField(outbox, "id", id);
        setField(outbox, "status", retryCount > 0 ? OutboxStatus.SEND_FAIL : OutboxStatus.INIT);
        setField(outbox, "retryCount", retryCount);
        return outbox;
    }

    private void pending(Outbox... outboxes) {
        given(outboxRepository.findPendingEvents(
                eq(OutboxStatus.SEND_FAIL), eq(OutboxStatus.INIT), any(LocalDateTime.class), eq(MAX_RETRY), any()))
                .willReturn(List.of(outboxes));
    }

    @Nested
    @DisplayName("재발행")
    class RepublishTest {

        @Test
        @DisplayName("성공 : 회원 ID, 등급 변경 타입으로 발행 후 PUBLISHED")
        void republish_success() {
            // given
            pending(tierChanged(1L, 42L, 1));

            // when
            int published = scheduler.republishPending();

            // then
            assertThat(published).isEqualTo(1);
            then(messagePublisher).should().publish(argThat((OutboxMessage message) ->
                    message.outboxId().equals(1L)
                            && message.memberId().equals(42L)
                            && message.eventType() == EventType.TIER_CHANGED));
            then(statusUpdater).should().markAsPublished(1L);
            then(alertService).shouldHaveNoInteractions();
            assertThat(meterRegistry.get("outbox_events_published_total")
                    .tag("result", "success").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("INIT 조회 기준 시각은 Clock 기준 5분 전")
        void staleThreshold_fromClock() {
            // given
            given(outboxRepository.findPendingEvents(any(), any(), any(), eq(MAX_RETRY), any()))
                    .willReturn(List.of());

            // when
            scheduler.republishPending();

            // then
            then(outboxRepository).should().findPendingEvents(
                    eq(OutboxStatus.SEND_FAIL), eq(OutboxStatus.INIT),
                    eq(BASE_TIME.minusMinutes(STALE_MINUTES)), eq(MAX_RETRY), any());
        }

        @Test
        @DisplayName("한 건 실패해도 나머지 계속, 한도 전이면 알림 없음")
        void partialFailure_continues() {
            // given
            Outbox failing = tierChanged(1L, 42L, 1);
            Outbox ok = tierChanged(2L, 43L, 0);
            pending(failing, ok);
            willAnswer(invocation -> {
                OutboxMessage message = invocation.getArgument(0);
                if (message.outboxId().equals(1L)) {
                    throw new AmqpException("connection refused");
                }
                return null;
            }).given(messagePublisher).publish(any(OutboxMessage.class));

            // when
            int published = scheduler.republishPending();

            // then
            assertThat(published).isEqualTo(1);
            then(statusUpdater).should().markAsFailed(1L);
            then(statusUpdater).should().markAsPublished(2L);
            then(alertService).shouldHaveNoInteractions();
        }
    }

    @Nested
    @DisplayName("재시도 한도")
    class RetryExhaustedTest {

        @Test
        @DisplayName("마지막 재시도 실패 -> 운영자 알림 (회원 ID, 이벤트 ID)")
        void lastAttemptFails_alerts() {
            // given
            Outbox outbox = tierChanged(1L, 42L, MAX_RETRY - 1);
            pending(outbox);
            willThrow(new AmqpException("broker down")).given(messagePublisher).publish(any(OutboxMessage.class));

            // when
            scheduler.republishPending();

            // then
            then(statusUpdater).should().markAsFailed(1L);
            then(alertService).should().alertEventRetryExhausted(
                    eq(42L), eq("TierChangedEvent"), eq(outbox.getEventId()), anyString());
        }

        @Test
        @DisplayName("알 수 없는 이벤트 타입 행 -> 발행 시도 없이 실패 기록")
        void unknownEventType_markedFailed() {
            // given
            Outbox outbox = tierChanged(1L, 42L, 1);
            setField(outbox, "eventType", "GiftSentEvent");
            pending(outbox);

            // when
            scheduler.republishPending();

            // then
            then(messagePublisher).should(never()).publish(any());
            then(statusUpdater).should().markAsFailed(1L);
        }
    }

    @Test
    @DisplayName("종료 요청 후에는 조회하지 않음")
    void shutdown_skips() {
        // when
        scheduler.shutdown();
        int published = scheduler.republishPending();

        // then
        assertThat(published).isZero();
        then(outboxRepository).shouldHaveNoInteractions();
    }
}
