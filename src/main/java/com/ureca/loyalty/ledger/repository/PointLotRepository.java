package com.ureca.loyalty.ledger.repository;

import com.ureca.loyalty.ledger.entity.PointLot;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface PointLotRepository extends JpaRepository<PointLot, Long> {

    Optional<PointLot> findByTransactionId(Long transactionId);

    // 잔여 포인트가 남은 묶음 (적립 순)
    @Query("SELECT l FROM PointLot l " +
            "WHERE l.memberId = :memberId AND l.remainingAmount > 0 " +
            "ORDER BY l.createdAt ASC, l.id ASC")
    List<PointLot> findOpenLots(@Param("memberId") Long memberId);

    // 만료 시각이 지났는데 잔여 포인트가 남은 묶음 (적립 순)
    @Query("SELECT l FROM PointLot l " +
            "WHERE l.memberId = :memberId AND l.remainingAmount > 0 " +
            "AND l.expiresAt IS NOT NULL AND l.expiresAt <= :now " +
            "ORDER BY l.createdAt ASC, l.id ASC")
    List<PointLot> findExpiredOpenLots(
            @Param("memberId") Long memberId,
            @Param("now") LocalDateTime now
    );

    /**
     * 소멸 대상 회원 ID 조회 (memberId 커서)
     * 실패한 회원이 있어도 다음 회원으로 진행되도록 afterMemberId 이후만 조회
     *
     * @param now           기준 시각
     * @param afterMemberId 직전 배치 마지막 회원 ID
     * @param pageable      배치 크기
     * @return 회원 ID 오름차순
     */
    @Query("SELECT DISTINCT l.memberId FROM PointLot l " +
            "WHERE l.remainingAmount > 0 " +
            "AND l.expiresAt IS NOT NULL AND l.expiresAt <= :now " +
            "AND l.memberId > :afterMemberId " +
            "ORDER BY l.memberId ASC")
    List<Long> findMemberIdsWithExpiredLots(
            @Param("now") LocalDateTime now,
            @Param("afterMemberId") Long afterMemberId,
            Pageable pageable
    );

    @Query("SELECT COALESCE(SUM(l.remainingAmount), 0) FROM PointLot l WHERE l.memberId = :memberId")
    long sumRemainingByMemberId(@Param("memberId") Long memberId);
}
