package com.ureca.loyalty.config;

import com.ureca.loyalty.common.event.EventType;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 포인트 도메인 이벤트 발행용 RabbitMQ 설정
 * <p>
 * loyalty.exchange -> loyalty.tier.changed.queue
 * 소비 실패 시 dlx.outbox -> dlq.loyalty.tier.changed.queue
 * Publisher Confirms 는 spring.rabbitmq.publisher-confirm-type=correlated 로 활성화
 */
@Configuration
public class LoyaltyRabbitMQConfig {

    @Bean
    public Jackson2JsonMessageConverter jackson2JsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, Jackson2JsonMessageConverter converter) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(converter);
        return template;
    }

    // --------------------- Exchange --------------------------

    @Bean
    public DirectExchange loyaltyExchange() {
        return new DirectExchange(RabbitMQQueue.LOYALTY_EXCHANGE);
    }

    @Bean
    public DirectExchange outboxDeadLetterExchange() {
        return new DirectExchange(RabbitMQQueue.OUTBOX_DLX);
    }

    // --------------------- Tier Changed --------------------------

    @Bean
    public Queue tierChangedQueue() {
        return QueueBuilder.durable(RabbitMQQueue.TIER_CHANGED_QUEUE)
                .withArgument("x-dead-letter-exchange", RabbitMQQueue.OUTBOX_DLX)
                .withArgument("x-dead-letter-routing-key", RabbitMQQueue.TIER_CHANGED_DLX_ROUTING_KEY)
                .build();
    }

    @Bean
    public Queue tierChangedDlq() {
        return new Queue(RabbitMQQueue.TIER_CHANGED_DLQ, true);
    }

    @Bean
    public Binding tierChangedBinding() {
        return BindingBuilder
                .bind(tierChangedQueue())
                .to(loyaltyExchange())
                .with(EventType.TIER_CHANGED.getRoutingKey());
    }

    @Bean
    public Binding tierChangedDlqBinding() {
        return BindingBuilder
                .bind(tierChangedDlq())
                .to(outboxDeadLetterExchange())
                .with(RabbitMQQueue.TIER_CHANGED_DLX_ROUTING_KEY);
    }
}
