package com.ureca.loyalty.common.exception;

import com.ureca.loyalty.common.BaseCode;
import lombok.Getter;

@Getter
public abstract class BaseCustomException extends RuntimeException {
    private final BaseCode baseCode;

    protected BaseCustomException(BaseCode baseCode) {
        super(baseCode.getMessage());
        this.baseCode = baseCode;
    }

    protected BaseCustomException(BaseCode baseCode, String customMessage) {
        super(customMessage);
        this.baseCode = baseCode;
    }

    // 원인 같이 받음
    protected BaseCustomException(BaseCode baseCode, String customMessage, Throwable cause) {
        super(customMessage, cause);
        this.baseCode = baseCode;
    }
}
