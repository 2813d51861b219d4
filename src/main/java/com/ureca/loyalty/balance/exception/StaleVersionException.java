package com.ureca.loyalty.balance.exception;

import com.ureca.loyalty.common.exception.BaseCustomException;

import static com.ureca.loyalty.common.BaseCode.LEDGER_BUSY;

/**
 * 읽은 버전과 현재 잔액 버전이 다름
 * 덮어쓰지 않고 MemberLockExecutor 가 재시도, 한도 초과 시 BusyException
 */
public class StaleVersionException extends BaseCustomException {

    public StaleVersionException(Long memberId, long expectedVersion, long actualVersion) {
        super(LEDGER_BUSY, "잔액 버전 불일치. memberId: " + memberId
                + ", expected: " + expectedVersion + ", actual: " + actualVersion);
    }
}
