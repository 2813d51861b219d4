package com.ureca.loyalty.common.exception;

import com.ureca.loyalty.common.ApiResponse;
import com.ureca.loyalty.common.BaseCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

import static com.ureca.loyalty.common.BaseCode.INTERNAL_SERVER_ERROR;
import static com.ureca.loyalty.common.BaseCode.INVALID_INPUT;

/**
 * 예외 -> ApiResponse 에러 응답
 * 4xx 는 warn, 5xx 는 error + 스택 트레이스
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BaseCustomException.class)
    public ResponseEntity<ApiResponse<Void>> handleCustomException(BaseCustomException e) {
        BaseCode baseCode = e.getBaseCode();

        if (baseCode.getStatus().is5xxServerError()) {
            log.error("[예외 처리] 서버 예외. code : {}, message : {}", baseCode.getCode(), e.getMessage(), e);
        } else {
            log.warn("[예외 처리] 비즈니스 예외. code : {}, message : {}", baseCode.getCode(), e.getMessage());
        }

        return ResponseEntity.status(baseCode.getStatus())
                .body(ApiResponse.error(baseCode, e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(this::format)
                .collect(Collectors.joining(", "));

        log.warn("[예외 처리] 요청 검증 실패. {}", message);
        return invalidInput(message);
    }

    @ExceptionHandler({
            HandlerMethodValidationException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e) {
        log.warn("[예외 처리] 잘못된 요청. type : {}, message : {}", e.getClass().getSimpleName(), e.getMessage());
        return invalidInput(INVALID_INPUT.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("[예외 처리] 예상하지 못한 예외", e);
        return ResponseEntity.status(INTERNAL_SERVER_ERROR.getStatus())
                .body(ApiResponse.error(INTERNAL_SERVER_ERROR, INTERNAL_SERVER_ERROR.getMessage()));
    }

    private ResponseEntity<ApiResponse<Void>> invalidInput(String message) {
        return ResponseEntity.status(INVALID_INPUT.getStatus())
                .body(ApiResponse.error(INVALID_INPUT, message));
    }

    private String format(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
