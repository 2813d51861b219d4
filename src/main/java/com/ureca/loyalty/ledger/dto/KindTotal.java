package com.ureca.loyalty.ledger.dto;

import com.ureca.loyalty.ledger.entity.TransactionKind;

public record KindTotal(
        TransactionKind kind,
        Long amountSum,   // 부호 포함
        Long count
) {
}
