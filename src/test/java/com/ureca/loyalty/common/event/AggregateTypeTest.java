package com.ureca.loyalty.common.event;

import com.ureca.loyalty.common.exception.UnknownAggregateTypeException;
import com.ureca.loyalty.common.exception.UnknownEventTypeException;
import com.ureca.loyalty.config.AggregateExchangeMapper;
import com.ureca.loyalty.config.RabbitMQQueue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregateTypeTest {

    @Test
    @DisplayName("성공 : Outbox 문자열 -> Enum -> Exchange, 라우팅 키")
    void from_Success() {
        // when
        AggregateType aggregateType = AggregateType.from("LOYALTY");
        EventType eventType = EventType.from("TierChangedEvent");

        // then
        assertThat(AggregateExchangeMapper.getExchange(aggregateType)).isEqualTo(RabbitMQQueue.LOYALTY_EXCHANGE);
        assertThat(eventType.getRoutingKey()).isEqualTo("loyalty.tier.changed");
    }

    @Test
    @DisplayName("예외 : 이상한 값, null -> 예외 발생")
    void from_Fail() {
        // given
        String[] invalid = {"MEMBER", "PAYMENT", "", null};

        // when, then
        for (String str : invalid) {
            assertThatThrownBy(() -> AggregateType.from(str))
                    .isInstanceOf(UnknownAggregateTypeException.class);
            assertThatThrownBy(() -> EventType.from(str))
                    .isInstanceOf(UnknownEventTypeException.class);
        }
    }
}
