package com.ureca.loyalty.ledger.exception;

import com.ureca.loyalty.common.exception.BusinessException;

import static com.ureca.loyalty.common.BaseCode.INVALID_LEDGER_ENTRY;

public class InvalidLedgerEntryException extends BusinessException {

    public InvalidLedgerEntryException(String message) {
        super(INVALID_LEDGER_ENTRY, message);
    }
}
