package com.ureca.loyalty.ledger.entity;

import com.ureca.loyalty.ledger.exception.InvalidLedgerEntryException;
import com.ureca.loyalty.ledger.exception.InvalidPointAmountException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 적립 항목별 잔여 포인트 묶음
 * <p>
 * 적립성 항목(EARN, ADMIN_AWARD)마다 하나씩 열리고
 * 사용/차감은 오래된 묶음부터, 소멸은 묶음 단위로 잔여분을 0으로 만든다
 * 회원의 remainingAmount 합 == 잔액 캐시
 */
@Entity
@Table(name = "point_lot",
        indexes = {
                @Index(name = "idx_point_lot_member_remaining", columnList = "member_id, remaining_amount"),
                @Index(name = "idx_point_lot_expires_remaining", columnList = "expires_at, remaining_amount")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_point_lot_transaction", columnNames = {"transaction_id"})
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PointLot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "point_lot_id")
    private Long id;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private Long transactionId;

    @Column(name = "member_id", nullable = false, updatable = false)
    private Long memberId;

    @Column(name = "original_amount", nullable = false, updatable = false)
    private Long originalAmount;

    @Column(name = "remaining_amount", nullable = false)
    private Long remainingAmount;

    @Column(name = "expires_at", updatable = false)
    private LocalDateTime expiresAt; // null 이면 만료 없음 (관리자 지급)

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private PointLot(Long transactionId, Long memberId, Long amount,
                     LocalDateTime expiresAt, LocalDateTime createdAt) {
        this.transactionId = transactionId;
        this.memberId = memberId;
        this.originalAmount = amount;
        this.remainingAmount = amount;
        this.expiresAt = expiresAt;
        this.createdAt = createdAt;
    }

    public static PointLot open(PointsTransaction credit) {
        if (credit.getId() == null || !credit.getKind().isCredit()) {
            throw new InvalidLedgerEntryException("저장된 적립성 항목만 포인트 묶음을 열 수 있습니다.");
        }
        return new PointLot(
                credit.getId(),
                credit.getMemberId(),
                credit.getAmount(),
                credit.getExpiresAt(),
                credit.getCreatedAt()
        );
    }

    public void consume(long amount) {
        if (amount <= 0) {
            throw new InvalidPointAmountException();
        }
        if (amount > remainingAmount) {
            throw new InvalidLedgerEntryException(
                    "묶음 잔여 포인트보다 많이 차감할 수 없습니다. lotId: " + id + ", remaining: " + remainingAmount);
        }
        this.remainingAmount -= amount;
    }

    /**
     * 남은 포인트 전부 소멸
     *
     * @return 소멸된 포인트
     */
    public long expire() {
        long expired = remainingAmount;
        this.remainingAmount = 0L;
        return expired;
    }

    // expiresAt <= now
    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isOpen() {
        return remainingAmount > 0;
    }
}
