package com.ureca.loyalty.ledger.repository;

import com.ureca.loyalty.ledger.dto.KindTotal;
import com.ureca.loyalty.ledger.entity.PointsTransaction;
import com.ureca.loyalty.ledger.entity.TransactionKind;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;

// QueryDSL 동적 쿼리용 커스텀 레포지토리
public interface PointsTransactionRepositoryCustom {

    /**
     * 회원 포인트 내역 최신순 페이지 조회
     *
     * @param memberId 회원 ID
     * @param kind     종류 필터 (null 이면 전체)
     * @param pageable 0부터 시작하는 페이지 정보
     * @return createdAt DESC, id DESC 정렬된 페이지
     */
    Page<PointsTransaction> findHistory(Long memberId, TransactionKind kind, Pageable pageable);

    // 종류별 금액 합계, 건수
    List<KindTotal> sumAmountGroupByKind(Long memberId);
}
