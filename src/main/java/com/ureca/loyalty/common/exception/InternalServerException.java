package com.ureca.loyalty.common.exception;

import com.ureca.loyalty.common.BaseCode;

/**
 * 서버 내부에서 발생하는 비즈니스 예외가 아닌 복구 불가능한 예외
 * BaseCode 의 상태코드(5xx)로 응답
 */
public class InternalServerException extends BaseCustomException {

    public InternalServerException(BaseCode baseCode) {
        super(baseCode);
    }

    public InternalServerException(BaseCode baseCode, String message) {
        super(baseCode, message);
    }

    public InternalServerException(BaseCode baseCode, String message, Throwable cause) {
        super(baseCode, message, cause);
    }
}
