package com.ureca.loyalty.common.exception;

import com.ureca.loyalty.common.BaseCode;

/**
 * 비즈니스 규칙 위반 예외
 * 호출자에게 그대로 노출되고 자동 재시도 대상이 아니다
 */
public abstract class BusinessException extends BaseCustomException {

    protected BusinessException(BaseCode baseCode) {
        super(baseCode);
    }

    protected BusinessException(BaseCode baseCode, String customMessage) {
        super(baseCode, customMessage);
    }
}
