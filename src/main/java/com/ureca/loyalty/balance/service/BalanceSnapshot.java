package com.ureca.loyalty.balance.service;

import java.time.LocalDateTime;

public record BalanceSnapshot(
        Long memberId,
        long balance,
        long version,
        LocalDateTime updatedAt
) {
}
