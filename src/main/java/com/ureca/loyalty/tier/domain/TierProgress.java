package com.ureca.loyalty.tier.domain;

/**
 * 다음 등급까지 진행도
 * 최상위 등급이면 nextTier, pointsToNextTier 는 null 이고 진행도는 100
 */
public record TierProgress(
        String currentTier,
        String nextTier,
        Long pointsToNextTier,
        int progressPercentage
) {
}
