package com.ureca.loyalty.outbox.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ureca.loyalty.outbox.entity.Outbox;
import com.ureca.loyalty.outbox.entity.OutboxStatus;
import com.ureca.loyalty.outbox.event.OutboxScheduledEvent;
import com.ureca.loyalty.outbox.repository.OutboxRepository;
import com.ureca.loyalty.tier.event.TierChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import static com.ureca.loyalty.support.TestReflectionUtils.setField;
import static com.ureca.loyalty.support.fixture.LedgerFixture.BASE_TIME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@DisplayName("OutboxEventListener 단위 테스트")
@ExtendWith(MockitoExtension.class)
class OutboxEventListenerTest {

    private OutboxEventListener listener;

    @Mock
    private OutboxRepository outboxRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Captor
    private ArgumentCaptor<Outbox> outboxCaptor;

    @Captor
    private ArgumentCaptor<OutboxScheduledEvent> scheduledCaptor;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        listener = new OutboxEventListener(outboxRepository, eventPublisher, objectMapper);
    }

    @Test
    @DisplayName("성공 : 등급 변경 이벤트를 INIT 상태로 저장하고 즉시 발행 이벤트 전달")
    void saveToOutbox_tierChanged() {
        // given
        TierChangedEvent event = new TierChangedEvent(100L, "Bronze", "Silver", 200L, BASE_TIME);
        given(outboxRepository.save(any(Outbox.class))).willAnswer(invocation -> {
            Outbox outbox = invocation.getArgument(0);
            setField(outbox, "id", 1L);
            return outbox;
        });

        // when
        listener.saveToOutbox(event);

        // then
        verify(outboxRepository).save(outboxCaptor.capture());
        Outbox saved = outboxCaptor.getValue();
        assertThat(saved.getStatus()).isEqualTo(OutboxStatus.INIT);
        assertThat(saved.getEventType()).isEqualTo("TierChangedEvent");
        assertThat(saved.getAggregateType()).isEqualTo("LOYALTY");
        assertThat(saved.getAggregateId()).isEqualTo(100L);
        assertThat(saved.getPayload())
                .contains("\"newTier\":\"Silver\"")
                .doesNotContain("aggregateId");

        verify(eventPublisher).publishEvent(scheduledCaptor.capture());
        OutboxScheduledEvent scheduled = scheduledCaptor.getValue();
        assertThat(scheduled.outboxId()).isEqualTo(1L);
        assertThat(scheduled.eventId()).isEqualTo(saved.getEventId());
    }
}
