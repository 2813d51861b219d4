package com.ureca.loyalty.tier.service;

import com.ureca.loyalty.balance.entity.PointBalance;
import com.ureca.loyalty.tier.domain.TierAssignment;
import com.ureca.loyalty.tier.domain.TierProgress;
import com.ureca.loyalty.tier.dto.TierResponse;

import java.time.LocalDateTime;
import java.util.List;

public interface TierService {

    // 설정된 등급 (오름차순)
    List<TierResponse> getTiers();

    String tierOf(long balance);

    TierProgress progressOf(long balance);

    /**
     * 잔액 반영 직후 등급 재계산
     * 캐시된 등급과 다르면 갱신하고 TierChangedEvent 발행
     * 호출자의 회원 잠금 트랜잭션 안에서만 호출
     *
     * @param balance 잠금 획득 후 잔액이 반영된 행
     * @param now     변경 시각
     * @return 재계산된 등급
     */
    String reassess(PointBalance balance, LocalDateTime now);

    /**
     * 회원 등급 강제 재계산 (등급 기준 변경 후 등)
     *
     * @param memberId 회원 ID
     * @return 재계산 후 등급
     */
    TierAssignment recalculate(Long memberId);
}
