package com.ureca.loyalty.outbox.exception;

import com.ureca.loyalty.common.exception.InternalServerException;

import static com.ureca.loyalty.common.BaseCode.INTERNAL_SERVER_ERROR;

// 이벤트 직렬화 실패, 원장 트랜잭션까지 롤백
public class OutboxSerializationException extends InternalServerException {

    public OutboxSerializationException(String message, Throwable cause) {
        super(INTERNAL_SERVER_ERROR, message, cause);
    }
}
