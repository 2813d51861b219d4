package com.ureca.loyalty.tier.dto;

import com.ureca.loyalty.tier.domain.TierDefinition;

public record TierResponse(
        int level,         // 1부터, 높을수록 상위 등급
        String tierName,
        long minBalance
) {
    public static TierResponse of(int level, TierDefinition definition) {
        return new TierResponse(level, definition.tierName(), definition.minBalance());
    }
}
