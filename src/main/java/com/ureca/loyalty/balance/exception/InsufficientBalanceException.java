package com.ureca.loyalty.balance.exception;

import com.ureca.loyalty.common.exception.BusinessException;

import static com.ureca.loyalty.common.BaseCode.INSUFFICIENT_BALANCE;

public class InsufficientBalanceException extends BusinessException {

    public InsufficientBalanceException(long currentBalance, long requested) {
        super(INSUFFICIENT_BALANCE,
                "포인트 잔액이 부족합니다. 잔액: " + currentBalance + ", 요청: " + requested);
    }
}
