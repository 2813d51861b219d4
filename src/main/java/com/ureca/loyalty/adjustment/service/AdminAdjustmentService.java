package com.ureca.loyalty.adjustment.service;

import com.ureca.loyalty.point.dto.MutationResult;

public interface AdminAdjustmentService {

    /**
     * 관리자 포인트 조정
     * 양수면 ADMIN_AWARD, 음수면 ADMIN_DEDUCT 로 기록
     *
     * @param memberId        회원 ID
     * @param amount          0이 아닌 조정 포인트
     * @param actorId         처리 관리자
     * @param reason          조정 사유 (500자 이내)
     * @param idempotencyKey  멱등키
     * @param capabilityToken 관리자 권한 토큰 (감사 기록용)
     * @return 조정 결과 (중복이면 이전 결과)
     * @throws com.ureca.loyalty.adjustment.exception.InvalidAdjustmentException 입력 오류
     * @throws com.ureca.loyalty.balance.exception.InsufficientBalanceException  차감 후 잔액 음수
     */
    MutationResult adminAdjust(Long memberId, long amount, String actorId, String reason,
                               String idempotencyKey, String capabilityToken);
}
