package com.ureca.loyalty.concurrency.exception;

import com.ureca.loyalty.common.exception.BusinessException;

import static com.ureca.loyalty.common.BaseCode.LEDGER_BUSY;

// 재시도 한도까지 충돌, 호출자가 잠시 후 같은 멱등키로 재시도
public class BusyException extends BusinessException {

    public BusyException(Long memberId, int attempts) {
        super(LEDGER_BUSY, "동시 요청 충돌로 처리하지 못했습니다. memberId: " + memberId + ", attempts: " + attempts);
    }
}
