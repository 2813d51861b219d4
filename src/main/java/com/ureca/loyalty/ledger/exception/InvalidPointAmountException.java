package com.ureca.loyalty.ledger.exception;

import com.ureca.loyalty.common.exception.BusinessException;

import static com.ureca.loyalty.common.BaseCode.INVALID_POINT_AMOUNT;

public class InvalidPointAmountException extends BusinessException {

    public InvalidPointAmountException() {
        super(INVALID_POINT_AMOUNT);
    }
}
