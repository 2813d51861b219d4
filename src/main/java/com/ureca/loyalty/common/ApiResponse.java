package com.ureca.loyalty.common;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 응답 포맷
 * 성공, 실패 모두 BaseCode 의 code, message 를 그대로 내려준다
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        String code,
        String message,
        T data
) {
    public static <T> ApiResponse<T> of(BaseCode baseCode, T data) {
        return new ApiResponse<>(baseCode.getCode(), baseCode.getMessage(), data);
    }

    public static ApiResponse<Void> ok(BaseCode baseCode) {
        return new ApiResponse<>(baseCode.getCode(), baseCode.getMessage(), null);
    }

    public static ApiResponse<Void> error(BaseCode baseCode, String message) {
        return new ApiResponse<>(baseCode.getCode(), message, null);
    }
}
