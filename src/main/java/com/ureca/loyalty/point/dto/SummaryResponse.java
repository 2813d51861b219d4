package com.ureca.loyalty.point.dto;

import java.time.LocalDateTime;

/**
 * 회원 포인트 요약
 * totalRedeemed, totalExpired 는 양수 크기, totalAdjusted 는 관리자 조정 순합 (부호 포함)
 */
public record SummaryResponse(
        Long memberId,
        long totalEarned,
        long totalRedeemed,
        long totalExpired,
        long totalAdjusted,
        long currentBalance,
        long transactionCount,
        LocalDateTime lastTransactionAt
) {
}
