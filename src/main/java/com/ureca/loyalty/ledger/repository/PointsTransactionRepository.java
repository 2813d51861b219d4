package com.ureca.loyalty.ledger.repository;

import com.ureca.loyalty.ledger.entity.PointsTransaction;
import com.ureca.loyalty.ledger.entity.TransactionKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * JPA + QueryDSL
 * 원장은 append-only 라서 save 외의 변경 메소드는 쓰지 않는다
 */
public interface PointsTransactionRepository extends JpaRepository<PointsTransaction, Long>,
        PointsTransactionRepositoryCustom {

    Optional<PointsTransaction> findByTransactionKey(String transactionKey);

    boolean existsByTransactionKey(String transactionKey);

    Optional<PointsTransaction> findTopByMemberIdOrderByCreatedAtDescIdDesc(Long memberId);

    long countByMemberId(Long memberId);

    List<PointsTransaction> findByMemberIdAndKindOrderByIdAsc(Long memberId, TransactionKind kind);

    /**
     * 회원 원장 금액 합계
     * 잔액 캐시와 항상 같아야 한다
     *
     * @param memberId 회원 ID
     * @return 부호 포함 금액 합
     */
    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM PointsTransaction t WHERE t.memberId = :memberId")
    long sumAmountByMemberId(@Param("memberId") Long memberId);
}
