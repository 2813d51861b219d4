package com.ureca.loyalty.tier.dto;

import com.ureca.loyalty.tier.domain.TierAssignment;

import java.time.LocalDateTime;

public record TierAssignmentResponse(
        Long memberId,
        String tierName,
        LocalDateTime effectiveAt
) {
    public static TierAssignmentResponse from(TierAssignment assignment) {
        return new TierAssignmentResponse(
                assignment.memberId(),
                assignment.tierName(),
                assignment.effectiveAt()
        );
    }
}
