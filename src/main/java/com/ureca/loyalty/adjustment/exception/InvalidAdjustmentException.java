package com.ureca.loyalty.adjustment.exception;

import com.ureca.loyalty.common.exception.BusinessException;

import static com.ureca.loyalty.common.BaseCode.INVALID_ADJUSTMENT;

public class InvalidAdjustmentException extends BusinessException {

    public InvalidAdjustmentException(String message) {
        super(INVALID_ADJUSTMENT, message);
    }
}
