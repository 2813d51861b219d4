package com.ureca.loyalty.config;

/**
 * RabbitMQ Exchange / 큐 이름 중앙 관리
 * <p>
 * 네이밍 규칙:
 * - 일반 큐: {domain}.{event}.queue
 * - DLQ: dlq.{domain}.{event}.queue
 */
public final class RabbitMQQueue {

    public static final String LOYALTY_EXCHANGE = "loyalty.exchange";
    public static final String OUTBOX_DLX = "dlx.outbox";

    // 등급 변경 (알림, 혜택 등 외부 소비자용)
    public static final String TIER_CHANGED_QUEUE = "loyalty.tier.changed.queue";
    public static final String TIER_CHANGED_DLQ = "dlq.loyalty.tier.changed.queue";
    public static final String TIER_CHANGED_DLX_ROUTING_KEY = "dlx.loyalty.tier.changed";

    private RabbitMQQueue() {
    }
}
