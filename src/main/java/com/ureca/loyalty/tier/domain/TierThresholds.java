package com.ureca.loyalty.tier.domain;

import com.ureca.loyalty.tier.exception.InvalidTierConfigurationException;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 등급 기준 불변 스냅샷
 * <p>
 * 비어있지 않고, 첫 기준은 0, 기준은 엄격히 증가, 이름은 중복 없음
 * 설정에서 한 번 만들어 TierEngine 에 그대로 넘긴다
 */
public final class TierThresholds {

    private final List<TierDefinition> definitions;

    private TierThresholds(List<TierDefinition> definitions) {
        this.definitions = List.copyOf(definitions);
    }

    public static TierThresholds of(List<TierDefinition> definitions) {
        validate(definitions);
        return new TierThresholds(definitions);
    }

    private static void validate(List<TierDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new InvalidTierConfigurationException("등급이 하나 이상 필요합니다.");
        }
        if (definitions.get(0).minBalance() != 0) {
            throw new InvalidTierConfigurationException("첫 등급의 기준 잔액은 0이어야 합니다.");
        }

        Set<String> names = new HashSet<>();
        long previous = -1;
        for (TierDefinition definition : definitions) {
            if (definition.tierName() == null || definition.tierName().isBlank()) {
                throw new InvalidTierConfigurationException("등급 이름이 비어 있습니다.");
            }
            if (!names.add(definition.tierName())) {
                throw new InvalidTierConfigurationException("등급 이름 중복: " + definition.tierName());
            }
            if (definition.minBalance() <= previous) {
                throw new InvalidTierConfigurationException(
                        "등급 기준 잔액은 엄격히 증가해야 합니다: " + definition.tierName());
            }
            previous = definition.minBalance();
        }
    }

    // 오름차순
    public List<TierDefinition> definitions() {
        return definitions;
    }

    public TierDefinition lowest() {
        return definitions.get(0);
    }

    public Optional<TierDefinition> nextOf(String tierName) {
        for (int i = 0; i < definitions.size() - 1; i++) {
            if (definitions.get(i).tierName().equals(tierName)) {
                return Optional.of(definitions.get(i + 1));
            }
        }
        return Optional.empty();
    }
}
