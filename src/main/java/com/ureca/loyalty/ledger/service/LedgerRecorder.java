package com.ureca.loyalty.ledger.service;

import com.ureca.loyalty.ledger.entity.PointsTransaction;

import java.util.Optional;

/**
 * 포인트 원장 기록 (Transaction Store)
 * 호출자의 트랜잭션 안에서만 동작한다
 */
public interface LedgerRecorder {

    /**
     * 원장 항목 추가
     * 같은 transactionKey 가 이미 있으면 저장하지 않고 기존 항목을 돌려준다
     *
     * @param transaction 새 원장 항목
     * @return APPLIED 또는 ALREADY_APPLIED
     */
    AppendResult append(PointsTransaction transaction);

    Optional<PointsTransaction> findByTransactionKey(String transactionKey);
}
