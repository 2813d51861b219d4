package com.ureca.loyalty.balance.exception;

import com.ureca.loyalty.common.exception.BusinessException;
import lombok.Getter;

import static com.ureca.loyalty.common.BaseCode.INSUFFICIENT_BALANCE;

/**
 * 잔액이 음수가 되는 반영 시도
 * 사용, 관리자 차감 경로에서 InsufficientBalanceException 으로 바뀐다
 */
@Getter
public class NegativeBalanceException extends BusinessException {

    private final long currentBalance;
    private final long delta;

    public NegativeBalanceException(Long memberId, long currentBalance, long delta) {
        super(INSUFFICIENT_BALANCE,
                "잔액이 음수가 됩니다. memberId: " + memberId + ", balance: " + currentBalance + ", delta: " + delta);
        this.currentBalance = currentBalance;
        this.delta = delta;
    }
}
