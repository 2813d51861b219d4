package com.ureca.loyalty.point.service;

import com.ureca.loyalty.common.PageResult;
import com.ureca.loyalty.ledger.dto.TransactionResponse;
import com.ureca.loyalty.ledger.entity.TransactionKind;
import com.ureca.loyalty.point.dto.BalanceResponse;
import com.ureca.loyalty.point.dto.MutationResult;
import com.ureca.loyalty.point.dto.SummaryResponse;

public interface PointLedgerService {

    /**
     * 포인트 적립
     *
     * @param memberId       회원 ID
     * @param amount         적립 포인트 (양수)
     * @param sourceRef      적립 출처
     * @param idempotencyKey 호출자 멱등키
     * @param ttlDays        유효기간(일), null 이면 기본값
     * @return 적립 결과 (중복이면 이전 결과)
     */
    MutationResult earn(Long memberId, long amount, String sourceRef, String idempotencyKey, Integer ttlDays);

    /**
     * 포인트 사용
     * 오래된 적립분부터 차감
     *
     * @throws com.ureca.loyalty.balance.exception.InsufficientBalanceException 잔액 부족
     */
    MutationResult redeem(Long memberId, long amount, String sourceRef, String idempotencyKey);

    // 잠금 없이 조회, 거래가 없는 회원은 잔액 0 + 최하위 등급
    BalanceResponse getBalance(Long memberId);

    /**
     * 포인트 내역 최신순
     *
     * @param page 1부터
     * @param size 최대 100
     * @param kind null 이면 전체
     */
    PageResult<TransactionResponse> getHistory(Long memberId, int page, int size, TransactionKind kind);

    SummaryResponse getSummary(Long memberId);
}
