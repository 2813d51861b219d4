package com.ureca.loyalty.common.event;

import com.ureca.loyalty.common.exception.UnknownEventTypeException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * 이벤트 타입별 Routing Key 매핑
 * 새 이벤트 추가 시 Enum 만 수정
 */
@Getter
@RequiredArgsConstructor
public enum EventType {
    TIER_CHANGED("TierChangedEvent", "loyalty.tier.changed");

    private final String typeName;      // "TierChangedEvent"
    private final String routingKey;    // "loyalty.tier.changed"

    private static final Map<String, EventType> TYPE_MAP;

    static {
        TYPE_MAP = new HashMap<>();
        for (EventType type : values()) {
            TYPE_MAP.put(type.typeName, type);
        }
    }

    /**
     * 타입 이름으로 EventType 조회
     *
     * @param typeName 이벤트 타입 이름 (예: "TierChangedEvent")
     * @return EventType
     * @throws UnknownEventTypeException 알 수 없는 타입
     */
    public static EventType from(String typeName) {
        EventType type = TYPE_MAP.get(typeName);

        if (type == null) {
            throw new UnknownEventTypeException(typeName);
        }

        return type;
    }
}
