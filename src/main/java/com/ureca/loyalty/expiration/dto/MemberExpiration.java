package com.ureca.loyalty.expiration.dto;

// 회원 한 명의 소멸 처리 결과
public record MemberExpiration(
        Long memberId,
        int appendedCount,
        long expiredPoints
) {
}
