package com.ureca.loyalty.concurrency.exception;

import com.ureca.loyalty.common.exception.InternalServerException;

import static com.ureca.loyalty.common.BaseCode.LOCK_ACQUISITION_TIMEOUT;

/**
 * 회원 잔액 행 잠금 대기 초과
 * 요청은 부작용 없이 중단되며 잠금은 강제로 풀지 않는다
 */
public class LockAcquisitionTimeoutException extends InternalServerException {

    public LockAcquisitionTimeoutException(Long memberId, Throwable cause) {
        super(LOCK_ACQUISITION_TIMEOUT, "회원 잠금 획득 시간 초과. memberId: " + memberId, cause);
    }
}
