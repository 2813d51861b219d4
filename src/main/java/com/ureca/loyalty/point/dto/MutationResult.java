package com.ureca.loyalty.point.dto;

/**
 * 적립 / 사용 / 관리자 조정 결과
 * duplicate 면 이전에 처리된 결과 그대로
 */
public record MutationResult(
        Long transactionId,
        long balance,
        String tier,
        boolean duplicate
) {
    public static MutationResult applied(Long transactionId, long balance, String tier) {
        return new MutationResult(transactionId, balance, tier, false);
    }

    public static MutationResult duplicate(Long transactionId, long balance, String tier) {
        return new MutationResult(transactionId, balance, tier, true);
    }
}
