package com.ureca.loyalty.tier.service;

import com.ureca.loyalty.balance.entity.PointBalance;
import com.ureca.loyalty.concurrency.MemberLockExecutor;
import com.ureca.loyalty.tier.domain.TierAssignment;
import com.ureca.loyalty.tier.domain.TierDefinition;
import com.ureca.loyalty.tier.domain.TierProgress;
import com.ureca.loyalty.tier.domain.TierThresholds;
import com.ureca.loyalty.tier.dto.TierResponse;
import com.ureca.loyalty.tier.event.TierChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TierServiceImpl implements TierService {

    private final TierEngine tierEngine;
    private final TierThresholds tierThresholds;
    private final MemberLockExecutor memberLockExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public List<TierResponse> getTiers() {
        List<TierDefinition> definitions = tierThresholds.definitions();
        List<TierResponse> responses = new ArrayList<>();
        for (int i = 0; i < definitions.size(); i++) {
            responses.add(TierResponse.of(i + 1, definitions.get(i)));
        }
        return responses;
    }

    @Override
    public String tierOf(long balance) {
        return tierEngine.computeTier(balance, tierThresholds);
    }

    @Override
    public TierProgress progressOf(long balance) {
        return tierEngine.progress(balance, tierThresholds);
    }

    @Override
    public String reassess(PointBalance balance, LocalDateTime now) {
        String oldTier = balance.getTierName();
        String newTier = tierEngine.computeTier(balance.getCurrentBalance(), tierThresholds);

        if (newTier.equals(oldTier)) {
            return newTier;
        }

        balance.assignTier(newTier, now);
        eventPublisher.publishEvent(new TierChangedEvent(
                balance.getMemberId(),
                oldTier,
                newTier,
                balance.getCurrentBalance(),
                now
        ));

        log.info("[등급] 등급 변경. memberId : {}, {} -> {}, balance : {}",
                balance.getMemberId(), oldTier, newTier, balance.getCurrentBalance());
        return newTier;
    }

    @Override
    public TierAssignment recalculate(Long memberId) {
        log.info("[등급] 재계산 요청. memberId : {}", memberId);

        return memberLockExecutor.execute(memberId, balance -> {
            String tier = reassess(balance, LocalDateTime.now(clock));
            return new TierAssignment(memberId, tier, balance.getTierUpdatedAt());
        });
    }
}
