package com.ureca.loyalty.ledger.service;

import com.ureca.loyalty.ledger.entity.PointLot;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 사용/차감 포인트를 묶음에 배분 (FIFO)
 * <p>
 * 1. 아직 만료되지 않은 묶음을 오래된 순으로
 * 2. 부족하면 만료됐지만 소멸 배치가 아직 처리하지 않은 묶음을 오래된 순으로
 */
@Component
public class LotAllocator {

    private static final Comparator<PointLot> OLDEST_FIRST =
            Comparator.comparing(PointLot::getCreatedAt).thenComparing(PointLot::getId);

    /**
     * @param openLots 잔여 포인트가 남은 묶음
     * @param amount   배분할 포인트 (양수)
     * @param now      만료 판단 기준 시각
     * @return 묶음별 배분량 (소비 순서)
     * @throws IllegalStateException 묶음 잔여 합이 부족 (잔액 캐시와 묶음 불일치)
     */
    public List<LotAllocation> allocate(List<PointLot> openLots, long amount, LocalDateTime now) {
        List<PointLot> ordered = new ArrayList<>();
        openLots.stream()
                .filter(lot -> !lot.isExpiredAt(now))
                .sorted(OLDEST_FIRST)
                .forEach(ordered::add);
        openLots.stream()
                .filter(lot -> lot.isExpiredAt(now))
                .sorted(OLDEST_FIRST)
                .forEach(ordered::add);

        List<LotAllocation> allocations = new ArrayList<>();
        long remaining = amount;
        for (PointLot lot : ordered) {
            if (remaining == 0) {
                break;
            }
            long take = Math.min(remaining, lot.getRemainingAmount());
            if (take > 0) {
                allocations.add(new LotAllocation(lot, take));
                remaining -= take;
            }
        }

        if (remaining > 0) {
            throw new IllegalStateException("포인트 묶음 잔여 합이 부족합니다. 부족분: " + remaining);
        }
        return allocations;
    }
}
