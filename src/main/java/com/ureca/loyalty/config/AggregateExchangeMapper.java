package com.ureca.loyalty.config;

import com.ureca.loyalty.common.event.AggregateType;

import java.util.Map;

/**
 * AggregateType(도메인) -> Exchange(인프라) 매핑
 */
public class AggregateExchangeMapper {

    private static final Map<AggregateType, String> EXCHANGE_MAP = Map.of(
            AggregateType.LOYALTY, RabbitMQQueue.LOYALTY_EXCHANGE
    );

    public static String getExchange(AggregateType aggregateType) {
        String exchange = EXCHANGE_MAP.get(aggregateType);

        if (exchange == null) {
            throw new IllegalArgumentException(
                    "Exchange 매핑이 존재하지 않습니다. aggregateType: " + aggregateType
            );
        }

        return exchange;
    }

    private AggregateExchangeMapper() {
    }
}
