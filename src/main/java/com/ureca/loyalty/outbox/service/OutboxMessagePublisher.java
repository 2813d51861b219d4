package com.ureca.loyalty.outbox.service;

import com.ureca.loyalty.config.AggregateExchangeMapper;
import com.ureca.loyalty.outbox.dto.OutboxMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 포인트 도메인 이벤트 RabbitMQ 발행
 * <p>
 * exchange 는 Aggregate, routing key 는 이벤트 타입으로 정해진다 (등급 변경 -> loyalty.tier.changed)
 * 소비자는 eventId 헤더로 중복 수신을 걸러내고 memberId 헤더로 회원별 순서를 맞춘다
 * 브로커 ACK 를 받아야 성공, NACK 와 확인 대기 초과는 AmqpException
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxMessagePublisher {

    public static final String HEADER_EVENT_ID = "eventId";
    public static final String HEADER_EVENT_TYPE = "eventType";
    public static final String HEADER_MEMBER_ID = "memberId";

    private static final long CONFIRM_TIMEOUT_SECONDS = 5;

    private final RabbitTemplate rabbitTemplate;

    /**
     * @param message 발행할 이벤트
     * @throws AmqpException 브로커 NACK, 확인 대기 초과, 연결 실패
     */
    public void publish(OutboxMessage message) {
        String exchange = AggregateExchangeMapper.getExchange(message.aggregateType());
        String routingKey = message.eventType().getRoutingKey();
        CorrelationData correlationData = new CorrelationData(message.eventId());

        rabbitTemplate.convertAndSend(
                exchange,
                routingKey,
                message.payload(),
                amqpMessage -> {
                    amqpMessage.getMessageProperties().setHeader(HEADER_EVENT_ID, message.eventId());
                    amqpMessage.getMessageProperties().setHeader(HEADER_EVENT_TYPE, message.eventType().getTypeName());
                    amqpMessage.getMessageProperties().setHeader(HEADER_MEMBER_ID, message.memberId());
                    return amqpMessage;
                },
                correlationData
        );

        awaitAck(correlationData, message);

        log.debug("[이벤트 발행] 브로커 ACK. routingKey : {}, memberId : {}, eventId : {}",
                routingKey, message.memberId(), message.eventId());
    }

    private void awaitAck(CorrelationData correlationData, OutboxMessage message) {
        CorrelationData.Confirm confirm;
        try {
            confirm = correlationData.getFuture().get(CONFIRM_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            throw new AmqpException("브로커 확인 대기 초과. eventId: " + message.eventId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AmqpException("브로커 확인 대기 중 인터럽트. eventId: " + message.eventId(), e);
        } catch (ExecutionException e) {
            throw new AmqpException("브로커 확인 실패. eventId: " + message.eventId(), e.getCause());
        }

        if (!confirm.isAck()) {
            throw new AmqpException("브로커 NACK. memberId: " + message.memberId()
                    + ", eventId: " + message.eventId() + ", reason: " + confirm.getReason());
        }
    }
}
