package com.ureca.loyalty.balance.repository;

import com.ureca.loyalty.balance.entity.PointBalance;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PointBalanceRepository extends JpaRepository<PointBalance, Long> {

    /**
     * 회원 잔액 행 비관적 잠금
     * 대기 한도를 넘기면 PessimisticLockingFailureException
     *
     * @param memberId 회원 ID
     * @return 잠긴 잔액 행 (첫 거래 전이면 empty)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("select b from PointBalance b where b.memberId = :memberId")
    Optional<PointBalance> findByMemberIdWithLock(@Param("memberId") Long memberId);
}
