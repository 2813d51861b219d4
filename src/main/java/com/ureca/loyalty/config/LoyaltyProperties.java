package com.ureca.loyalty.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "loyalty")
public record LoyaltyProperties(
        List<TierPolicy> tiers,
        EarnPolicy earn,
        SweepPolicy sweep,
        ConcurrencyPolicy concurrency
) {
    public record TierPolicy(
            String name,
            long minBalance
    ) {
    }

    public record EarnPolicy(
            int defaultTtlDays
    ) {
    }

    public record SweepPolicy(
            String cron,
            int batchSize
    ) {
    }

    /**
     * 회원 단위 직렬화 재시도 정책
     *
     * @param maxAttempts 버전 충돌, 중복키 경합 시 최대 시도 횟수
     * @param delay       첫 재시도 대기(ms)
     * @param multiplier  지수 증가 배수
     */
    public record ConcurrencyPolicy(
            int maxAttempts,
            long delay,
            double multiplier
    ) {
    }
}
