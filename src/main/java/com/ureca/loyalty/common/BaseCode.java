package com.ureca.loyalty.common;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum BaseCode {

    // common
    STATUS_OK("STATUS_OK_200", HttpStatus.OK, "서버가 정상적으로 동작 중입니다."),
    INVALID_INPUT("INVALID_INPUT_400", HttpStatus.BAD_REQUEST, "잘못된 요청입니다."),

    // 포인트 적립 / 사용 - 성공
    POINT_EARN_SUCCESS("POINT_EARN_SUCCESS_200", HttpStatus.OK, "포인트 적립에 성공했습니다."),
    POINT_REDEEM_SUCCESS("POINT_REDEEM_SUCCESS_200", HttpStatus.OK, "포인트 사용에 성공했습니다."),
    ADMIN_ADJUST_SUCCESS("ADMIN_ADJUST_SUCCESS_200", HttpStatus.OK, "관리자 포인트 조정에 성공했습니다."),
    DUPLICATE_SUBMISSION("DUPLICATE_SUBMISSION_200", HttpStatus.OK, "이미 처리된 요청입니다. 이전 처리 결과를 반환합니다."),

    // 조회 - 성공
    BALANCE_SUCCESS("BALANCE_SUCCESS_200", HttpStatus.OK, "포인트 잔액 조회에 성공했습니다."),
    HISTORY_SUCCESS("HISTORY_SUCCESS_200", HttpStatus.OK, "포인트 내역 조회에 성공했습니다."),
    SUMMARY_SUCCESS("SUMMARY_SUCCESS_200", HttpStatus.OK, "포인트 요약 조회에 성공했습니다."),
    TIER_LIST_SUCCESS("TIER_LIST_SUCCESS_200", HttpStatus.OK, "등급 목록 조회에 성공했습니다."),
    TIER_RECALCULATE_SUCCESS("TIER_RECALCULATE_SUCCESS_200", HttpStatus.OK, "등급 재계산에 성공했습니다."),

    // 소멸
    SWEEP_SUCCESS("SWEEP_SUCCESS_200", HttpStatus.OK, "만료 포인트 소멸 처리가 완료되었습니다."),

    // 포인트 - 예외
    INVALID_POINT_AMOUNT("INVALID_POINT_AMOUNT_400", HttpStatus.BAD_REQUEST, "포인트는 0보다 크고 1회 한도 이하여야 합니다."),
    INVALID_TTL("INVALID_TTL_400", HttpStatus.BAD_REQUEST, "포인트 유효기간은 1일 이상이어야 합니다."),
    INSUFFICIENT_BALANCE("INSUFFICIENT_BALANCE_400", HttpStatus.BAD_REQUEST, "포인트 잔액이 부족합니다."),
    INVALID_LEDGER_ENTRY("INVALID_LEDGER_ENTRY_400", HttpStatus.BAD_REQUEST, "포인트 내역 정보가 유효하지 않습니다."),
    INVALID_ADJUSTMENT("INVALID_ADJUSTMENT_400", HttpStatus.BAD_REQUEST, "관리자 조정 요청이 유효하지 않습니다."),
    INVALID_TIER_CONFIGURATION("INVALID_TIER_CONFIGURATION_500", HttpStatus.INTERNAL_SERVER_ERROR, "등급 설정이 올바르지 않습니다."),

    // 동시성 - 예외
    LEDGER_BUSY("LEDGER_BUSY_409", HttpStatus.CONFLICT, "동시에 처리 중인 요청이 많습니다. 잠시 후 다시 시도해주세요."),
    LOCK_ACQUISITION_TIMEOUT("LOCK_ACQUISITION_TIMEOUT_503", HttpStatus.SERVICE_UNAVAILABLE, "회원 포인트 잠금 획득 시간이 초과되었습니다."),
    STORAGE_UNAVAILABLE("STORAGE_UNAVAILABLE_503", HttpStatus.SERVICE_UNAVAILABLE, "저장소에 일시적으로 접근할 수 없습니다. 잠시 후 다시 시도해주세요."),

    // 서버 내부 예외
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR_500", HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부 오류가 발생했습니다. 잠시 후 다시 시도해주세요.");

    private final String code;
    private final HttpStatus status;
    private final String message;
}
