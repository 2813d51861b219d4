package com.ureca.loyalty.point.dto;

import com.ureca.loyalty.tier.domain.TierProgress;

import java.time.LocalDateTime;

public record BalanceResponse(
        Long memberId,
        long balance,
        String tier,
        LocalDateTime asOf,
        String nextTier,          // 최상위 등급이면 null
        Long pointsToNextTier,    // 최상위 등급이면 null
        int progressPercentage
) {
    public static BalanceResponse of(Long memberId, long balance, String tier,
                                     LocalDateTime asOf, TierProgress progress) {
        return new BalanceResponse(
                memberId,
                balance,
                tier,
                asOf,
                progress.nextTier(),
                progress.pointsToNextTier(),
                progress.progressPercentage()
        );
    }
}
