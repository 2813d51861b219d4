package com.ureca.loyalty.outbox.service;

import com.ureca.loyalty.common.event.AggregateType;
import com.ureca.loyalty.common.event.EventType;
import com.ureca.loyalty.config.RabbitMQQueue;
import com.ureca.loyalty.outbox.dto.OutboxMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessagePostProcessor;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.verify;

/**
 * - 등급 변경 이벤트 -> loyalty.exchange / loyalty.tier.changed
 * - eventId, eventType, memberId 헤더
 * - ACK 만 성공, NACK 는 AmqpException
 */
@ExtendWith(MockitoExtension.class)
class OutboxMessagePublisherTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    @InjectMocks
    private OutboxMessagePublisher messagePublisher;

    private final OutboxMessage message = new OutboxMessage(
            1L,
            "event-uuid-001",
            EventType.TIER_CHANGED,
            AggregateType.LOYALTY,
            42L,
            "{\"memberId\":42,\"oldTier\":\"Bronze\",\"newTier\":\"Silver\"}"
    );

    private void brokerConfirms(boolean ack, String reason) {
        willAnswer(invocation -> {
            CorrelationData correlationData = invocation.getArgument(4);
            correlationData.getFuture().complete(new CorrelationData.Confirm(ack, reason));
            return null;
        }).given(rabbitTemplate).convertAndSend(
                anyString(), anyString(), any(Object.class), any(MessagePostProcessor.class), any(CorrelationData.class));
    }

    @Test
    @DisplayName("성공 : 등급 변경 라우팅, 헤더에 회원 ID 와 이벤트 ID")
    void publish_ack_routesTierChanged() {
        // given
        brokerConfirms(true, null);

        // when
        messagePublisher.publish(message);

        // then
        ArgumentCaptor<MessagePostProcessor> processorCaptor = ArgumentCaptor.forClass(MessagePostProcessor.class);
        ArgumentCaptor<CorrelationData> correlationCaptor = ArgumentCaptor.forClass(CorrelationData.class);
        verify(rabbitTemplate).convertAndSend(
                eq(RabbitMQQueue.LOYALTY_EXCHANGE),
                eq("loyalty.tier.changed"),
                eq(message.payload()),
                processorCaptor.capture(),
                correlationCaptor.capture()
        );

        assertThat(correlationCaptor.getValue().getId()).isEqualTo("event-uuid-001");

        Message sent = processorCaptor.getValue()
                .postProcessMessage(new Message(new byte[0], new MessageProperties()));
        MessageProperties properties = sent.getMessageProperties();
        assertThat((String) properties.getHeader(OutboxMessagePublisher.HEADER_EVENT_ID)).isEqualTo("event-uuid-001");
        assertThat((String) properties.getHeader(OutboxMessagePublisher.HEADER_EVENT_TYPE)).isEqualTo("TierChangedEvent");
        assertThat((Long) properties.getHeader(OutboxMessagePublisher.HEADER_MEMBER_ID)).isEqualTo(42L);
    }

    @Test
    @DisplayName("실패 : 브로커 NACK -> AmqpException (호출자가 SEND_FAIL 처리)")
    void publish_nack_throws() {
        // given
        brokerConfirms(false, "queue full");

        // when, then
        assertThatThrownBy(() -> messagePublisher.publish(message))
                .isInstanceOf(AmqpException.class)
                .hasMessageContaining("NACK")
                .hasMessageContaining("queue full");
    }
}
