package com.ureca.loyalty.config;

import com.ureca.loyalty.tier.domain.TierDefinition;
import com.ureca.loyalty.tier.domain.TierThresholds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * loyalty.tiers 설정을 불변 TierThresholds 로 변환
 * 잘못된 설정이면 기동 실패
 */
@Slf4j
@Configuration
public class TierConfig {

    @Bean
    public TierThresholds tierThresholds(LoyaltyProperties properties) {
        List<TierDefinition> definitions = properties.tiers() == null
                ? List.of()
                : properties.tiers().stream()
                .map(tier -> new TierDefinition(tier.name(), tier.minBalance()))
                .toList();

        TierThresholds thresholds = TierThresholds.of(definitions);
        log.info("[등급 설정] 등급 기준 로드 완료. tiers : {}", thresholds.definitions());
        return thresholds;
    }
}
