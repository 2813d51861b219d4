package com.ureca.loyalty.point.dto;

import com.ureca.loyalty.expiration.dto.SweepResult;

public record SweepResponse(
        int expiredCount,
        long expiredPoints,
        int failedMembers
) {
    public static SweepResponse from(SweepResult result) {
        return new SweepResponse(result.expiredCount(), result.expiredPoints(), result.failedMembers());
    }
}
