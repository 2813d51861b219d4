package com.ureca.loyalty.tier.domain;

/**
 * 등급 정의
 *
 * @param tierName   등급 이름
 * @param minBalance 이 등급의 최소 잔액 (포함)
 */
public record TierDefinition(
        String tierName,
        long minBalance
) {
}
