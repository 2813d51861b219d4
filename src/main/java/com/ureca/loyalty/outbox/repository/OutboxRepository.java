package com.ureca.loyalty.outbox.repository;

import com.ureca.loyalty.outbox.entity.Outbox;
import com.ureca.loyalty.outbox.entity.OutboxStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface OutboxRepository extends JpaRepository<Outbox, Long> {

    /**
     * 재발행 대상 조회
     * <p>
     * 1. SEND_FAIL + 재시도 한도 미만
     * 2. INIT + threshold 이전 생성 (즉시 발행이 유실된 이벤트)
     */
    @Query("SELECT o FROM Outbox o " +
            "WHERE (o.status = :failStatus AND o.retryCount < :maxRetry) " +
            "OR (o.status = :initStatus AND o.createdAt < :threshold) " +
            "ORDER BY o.id ASC")
    List<Outbox> findPendingEvents(
            @Param("failStatus") OutboxStatus failStatus,
            @Param("initStatus") OutboxStatus initStatus,
            @Param("threshold") LocalDateTime threshold,
            @Param("maxRetry") int maxRetry,
            Pageable pageable
    );

    List<Outbox> findByAggregateTypeAndAggregateIdOrderByIdAsc(String aggregateType, Long aggregateId);

    /**
     * INIT / SEND_FAIL -> PUBLISHED 원자적 업데이트
     * 즉시 발행기와 폴링 스케줄러가 동시에 성공해도 한 번만 반영
     *
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying
    @Query("UPDATE Outbox o " +
            "SET o.status = com.ureca.loyalty.outbox.entity.OutboxStatus.PUBLISHED, o.publishedAt = :now " +
            "WHERE o.id = :id " +
            "AND (o.status = com.ureca.loyalty.outbox.entity.OutboxStatus.INIT OR o.status = com.ureca.loyalty.outbox.entity.OutboxStatus.SEND_FAIL)")
    int markAsPublished(
            @Param("id") Long id,
            @Param("now") LocalDateTime now
    );

    @Modifying
    @Query("UPDATE Outbox o " +
            "SET o.status = com.ureca.loyalty.outbox.entity.OutboxStatus.SEND_FAIL, o.retryCount = o.retryCount + 1 " +
            "WHERE o.id = :id AND o.status <> com.ureca.loyalty.outbox.entity.OutboxStatus.PUBLISHED")
    int markAsFailedAndIncrementRetry(@Param("id") Long id);
}
