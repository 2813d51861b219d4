package com.ureca.loyalty.ledger.service;

import com.ureca.loyalty.ledger.entity.PointsTransaction;

/**
 * 원장 기록 결과
 * 중복 키는 예외가 아니라 ALREADY_APPLIED + 기존 항목으로 돌려준다
 */
public record AppendResult(
        Status status,
        PointsTransaction transaction
) {
    public enum Status {
        APPLIED,
        ALREADY_APPLIED
    }

    public static AppendResult applied(PointsTransaction transaction) {
        return new AppendResult(Status.APPLIED, transaction);
    }

    public static AppendResult alreadyApplied(PointsTransaction transaction) {
        return new AppendResult(Status.ALREADY_APPLIED, transaction);
    }

    public boolean isDuplicate() {
        return status == Status.ALREADY_APPLIED;
    }
}
