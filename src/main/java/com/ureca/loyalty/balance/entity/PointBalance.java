package com.ureca.loyalty.balance.entity;

import com.ureca.loyalty.balance.service.BalanceSnapshot;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 회원별 포인트 잔액 캐시
 * <p>
 * 원장 합계의 투영이며 원장 기록과 같은 트랜잭션에서만 갱신된다
 * 이 행이 회원 단위 직렬화의 잠금 대상 (SELECT ... FOR UPDATE)
 * 현재 등급(TierAssignment)도 함께 캐시
 */
@Entity
@Table(name = "point_balance")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PointBalance {

    @Id
    @Column(name = "member_id")
    private Long memberId;

    @Column(name = "current_balance", nullable = false)
    private Long currentBalance;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "tier_name", nullable = false, length = 50)
    private String tierName;

    @Column(name = "tier_updated_at", nullable = false)
    private LocalDateTime tierUpdatedAt;

    private PointBalance(Long memberId, String initialTier, LocalDateTime now) {
        this.memberId = memberId;
        this.currentBalance = 0L;
        this.updatedAt = now;
        this.tierName = initialTier;
        this.tierUpdatedAt = now;
    }

    // 첫 거래 시 생성, 잔액 0 + 최하위 등급
    public static PointBalance open(Long memberId, String lowestTier, LocalDateTime now) {
        return new PointBalance(memberId, lowestTier, now);
    }

    // BalanceProjector 가 검증한 결과만 반영
    public void apply(BalanceSnapshot snapshot) {
        this.currentBalance = snapshot.balance();
        this.updatedAt = snapshot.updatedAt();
    }

    public void assignTier(String tierName, LocalDateTime effectiveAt) {
        this.tierName = tierName;
        this.tierUpdatedAt = effectiveAt;
    }
}
