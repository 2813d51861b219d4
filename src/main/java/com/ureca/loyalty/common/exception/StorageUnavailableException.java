package com.ureca.loyalty.common.exception;

import static com.ureca.loyalty.common.BaseCode.STORAGE_UNAVAILABLE;

/**
 * DB 커넥션 획득 실패, 커밋 중 장애 등
 * 커밋된 것이 없으므로 같은 멱등키로 나중에 재시도해도 안전
 */
public class StorageUnavailableException extends InternalServerException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(STORAGE_UNAVAILABLE, message, cause);
    }
}
