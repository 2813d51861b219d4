package com.ureca.loyalty.ledger.exception;

import com.ureca.loyalty.common.exception.BusinessException;

import static com.ureca.loyalty.common.BaseCode.INVALID_TTL;

public class InvalidTtlException extends BusinessException {

    public InvalidTtlException() {
        super(INVALID_TTL);
    }
}
