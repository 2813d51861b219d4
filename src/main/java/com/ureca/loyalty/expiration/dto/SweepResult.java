package com.ureca.loyalty.expiration.dto;

/**
 * 소멸 배치 1회 결과
 *
 * @param expiredCount     추가된 EXPIRE 항목 수
 * @param expiredPoints    소멸된 포인트 합
 * @param processedMembers 처리 성공 회원 수
 * @param failedMembers    처리 실패 회원 수 (다음 배치에서 재시도)
 */
public record SweepResult(
        int expiredCount,
        long expiredPoints,
        int processedMembers,
        int failedMembers
) {
}
