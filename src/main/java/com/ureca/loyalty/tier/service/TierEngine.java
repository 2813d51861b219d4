package com.ureca.loyalty.tier.service;

import com.ureca.loyalty.tier.domain.TierDefinition;
import com.ureca.loyalty.tier.domain.TierProgress;
import com.ureca.loyalty.tier.domain.TierThresholds;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 잔액 -> 등급 순수 계산
 * 같은 입력이면 항상 같은 결과, 상태 없음
 */
@Component
public class TierEngine {

    /**
     * 잔액 이하 기준 중 가장 높은 등급 (하한 포함)
     *
     * @param balance    현재 잔액 (0 이상)
     * @param thresholds 등급 기준
     * @return 등급 이름
     */
    public String computeTier(long balance, TierThresholds thresholds) {
        validateBalance(balance);

        String tier = thresholds.lowest().tierName();
        for (TierDefinition definition : thresholds.definitions()) {
            if (balance >= definition.minBalance()) {
                tier = definition.tierName();
            } else {
                break;
            }
        }
        return tier;
    }

    /**
     * 다음 등급까지 필요한 포인트와 진행도
     * 진행도 = 잔액 / 다음 등급 기준 (반올림, 최대 100)
     */
    public TierProgress progress(long balance, TierThresholds thresholds) {
        String currentTier = computeTier(balance, thresholds);
        Optional<TierDefinition> next = thresholds.nextOf(currentTier);

        if (next.isEmpty()) {
            return new TierProgress(currentTier, null, null, 100);
        }

        long nextMin = next.get().minBalance();
        int percentage = (int) Math.min(100, Math.round(balance * 100.0 / nextMin));

        return new TierProgress(currentTier, next.get().tierName(), nextMin - balance, percentage);
    }

    private void validateBalance(long balance) {
        if (balance < 0) {
            throw new IllegalArgumentException("잔액은 음수일 수 없습니다: " + balance);
        }
    }
}
