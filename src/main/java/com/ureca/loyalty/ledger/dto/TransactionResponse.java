package com.ureca.loyalty.ledger.dto;

import com.ureca.loyalty.ledger.entity.PointsTransaction;
import com.ureca.loyalty.ledger.entity.TransactionKind;

import java.time.LocalDateTime;

public record TransactionResponse(
        Long id,
        TransactionKind kind,
        String kindName,   // 표시용
        Long amount,       // 부호 포함
        Long balanceAfter,
        LocalDateTime createdAt,
        LocalDateTime expiresAt,
        String sourceRef,
        String actorId,
        String note,
        Long originTransactionId
) {
    public static TransactionResponse from(PointsTransaction transaction) {
        return new TransactionResponse(
                transaction.getId(),
                transaction.getKind(),
                transaction.getKind().getDisplayName(),
                transaction.getAmount(),
                transaction.getBalanceAfter(),
                transaction.getCreatedAt(),
                transaction.getExpiresAt(),
                transaction.getSourceRef(),
                transaction.getActorId(),
                transaction.getNote(),
                transaction.getOriginTransactionId()
        );
    }
}
