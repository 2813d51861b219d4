package com.ureca.loyalty.balance.service;

import com.ureca.loyalty.balance.entity.PointBalance;
import com.ureca.loyalty.balance.exception.NegativeBalanceException;
import com.ureca.loyalty.balance.exception.StaleVersionException;
import com.ureca.loyalty.ledger.exception.InvalidPointAmountException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 잔액 투영 계산
 * 엔티티를 바꾸지 않고 반영 후 상태만 계산한다
 * 원장 기록이 APPLIED 된 뒤에 PointBalance.apply 로 반영
 */
@Slf4j
@Component
public class BalanceProjector {

    /**
     * @param balance         잠금 획득한 잔액 행
     * @param delta           부호 포함 변화량
     * @param expectedVersion 호출자가 읽은 버전
     * @param now             반영 시각
     * @return 반영 후 스냅샷
     * @throws StaleVersionException    버전 불일치
     * @throws NegativeBalanceException 반영 후 잔액 음수
     * @throws InvalidPointAmountException 잔액 범위(long) 초과
     */
    public BalanceSnapshot apply(PointBalance balance, long delta, long expectedVersion, LocalDateTime now) {
        long actualVersion = balance.getVersion();
        if (actualVersion != expectedVersion) {
            throw new StaleVersionException(balance.getMemberId(), expectedVersion, actualVersion);
        }

        long current = balance.getCurrentBalance();
        long next;
        try {
            next = Math.addExact(current, delta);
        } catch (ArithmeticException e) {
            log.warn("[잔액 반영] 잔액 범위 초과 거절. memberId : {}, balance : {}, delta : {}",
                    balance.getMemberId(), current, delta);
            throw new InvalidPointAmountException();
        }
        if (next < 0) {
            throw new NegativeBalanceException(balance.getMemberId(), current, delta);
        }

        return new BalanceSnapshot(balance.getMemberId(), next, actualVersion + 1, now);
    }
}
