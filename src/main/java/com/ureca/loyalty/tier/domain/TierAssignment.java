package com.ureca.loyalty.tier.domain;

import java.time.LocalDateTime;

public record TierAssignment(
        Long memberId,
        String tierName,
        LocalDateTime effectiveAt
) {
}
