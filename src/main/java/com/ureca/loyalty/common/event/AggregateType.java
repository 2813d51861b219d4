package com.ureca.loyalty.common.event;

import com.ureca.loyalty.common.exception.UnknownAggregateTypeException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Aggregate 타입
 * Outbox 에 저장되는 문자열과 Enum 변환
 * Exchange 매핑은 AggregateExchangeMapper 가 담당
 */
@Getter
@RequiredArgsConstructor
public enum AggregateType {
    LOYALTY("LOYALTY");

    private final String typeName;

    private static final Map<String, AggregateType> TYPE_MAP;

    static {
        TYPE_MAP = new HashMap<>();
        for (AggregateType type : values()) {
            TYPE_MAP.put(type.typeName, type);
        }
    }

    /**
     * 타입 이름으로 AggregateType 조회
     *
     * @param typeName 타입 이름 (예: "LOYALTY")
     * @return AggregateType
     * @throws UnknownAggregateTypeException 알 수 없는 타입
     */
    public static AggregateType from(String typeName) {
        AggregateType type = TYPE_MAP.get(typeName);

        if (type == null) {
            throw new UnknownAggregateTypeException(typeName);
        }

        return type;
    }
}
