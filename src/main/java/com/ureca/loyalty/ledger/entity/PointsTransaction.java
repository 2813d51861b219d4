package com.ureca.loyalty.ledger.entity;

import com.ureca.loyalty.ledger.exception.InvalidLedgerEntryException;
import com.ureca.loyalty.ledger.exception.InvalidPointAmountException;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 포인트 원장 항목 (append-only)
 * <p>
 * 저장 후 수정, 삭제하지 않는다. 정정은 반대 부호의 새 항목으로만 한다
 * transactionKey 유니크 제약이 중복 기록의 최종 방어선
 */
@Entity
@Table(name = "points_transaction",
        indexes = {
                // 회원별 최신순 내역 조회
                @Index(name = "idx_points_tx_member_created_id",
                        columnList = "member_id, created_at DESC, points_transaction_id DESC"),
                // 종류 필터 + 요약 집계
                @Index(name = "idx_points_tx_member_kind",
                        columnList = "member_id, kind")
        },
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_points_tx_transaction_key",
                        columnNames = {"transaction_key"}
                )
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(access = AccessLevel.PRIVATE)
public class PointsTransaction {

    public static final int MAX_NOTE_LENGTH = 500;

    // 1회 적립 / 사용 / 조정 한도
    public static final long MAX_AMOUNT = 1_000_000_000L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "points_transaction_id")
    private Long id;

    @Column(name = "transaction_key", nullable = false, length = 160, updatable = false)
    private String transactionKey;

    @Column(name = "member_id", nullable = false, updatable = false)
    private Long memberId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private TransactionKind kind;

    @Column(nullable = false, updatable = false)
    private Long amount; // 부호 포함

    @Column(name = "balance_after", nullable = false, updatable = false)
    private Long balanceAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", updatable = false)
    private LocalDateTime expiresAt; // EARN 만

    @Column(name = "source_ref", length = 100, updatable = false)
    private String sourceRef;

    @Column(name = "actor_id", length = 100, updatable = false)
    private String actorId;

    @Column(length = MAX_NOTE_LENGTH, updatable = false)
    private String note;

    @Column(name = "origin_transaction_id", updatable = false)
    private Long originTransactionId; // EXPIRE 만, 소멸시킨 적립 항목

    @Column(name = "admin_capability", length = 200, updatable = false)
    private String adminCapability;

    // 멱등키 생성 - {KIND}:{memberId}:{호출자 키}
    public static String generateTransactionKey(TransactionKind kind, Object... ids) {
        StringBuilder sb = new StringBuilder(kind.name());
        for (Object id : ids) {
            sb.append(":").append(id);
        }
        return sb.toString();
    }

    // 소멸 항목은 적립 항목당 하나
    public static String expirationKey(Long originTransactionId) {
        return generateTransactionKey(TransactionKind.EXPIRE, originTransactionId);
    }

    public static PointsTransaction earn(
            Long memberId,
            long amount,
            long balanceAfter,
            String sourceRef,
            String idempotencyKey,
            LocalDateTime createdAt,
            LocalDateTime expiresAt
    ) {
        validateMagnitude(amount);
        if (expiresAt == null || !expiresAt.isAfter(createdAt)) {
            throw new InvalidLedgerEntryException("적립 포인트 만료 시각은 적립 시각 이후여야 합니다.");
        }

        return PointsTransaction.builder()
                .transactionKey(generateTransactionKey(TransactionKind.EARN, memberId, idempotencyKey))
                .memberId(memberId)
                .kind(TransactionKind.EARN)
                .amount(TransactionKind.EARN.signed(amount))
                .balanceAfter(balanceAfter)
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .sourceRef(sourceRef)
                .build()
                .validate();
    }

    public static PointsTransaction redeem(
            Long memberId,
            long amount,
            long balanceAfter,
            String sourceRef,
            String idempotencyKey,
            LocalDateTime createdAt
    ) {
        validateMagnitude(amount);

        return PointsTransaction.builder()
                .transactionKey(generateTransactionKey(TransactionKind.REDEEM, memberId, idempotencyKey))
                .memberId(memberId)
                .kind(TransactionKind.REDEEM)
                .amount(TransactionKind.REDEEM.signed(amount))
                .balanceAfter(balanceAfter)
                .createdAt(createdAt)
                .sourceRef(sourceRef)
                .build()
                .validate();
    }

    /**
     * 만료된 적립분의 남은 포인트 소멸
     *
     * @param originTransactionId 소멸 대상 적립 항목 ID
     * @param amount              남은 포인트 (양수)
     */
    public static PointsTransaction expire(
            Long memberId,
            Long originTransactionId,
            long amount,
            long balanceAfter,
            LocalDateTime createdAt
    ) {
        validateMagnitude(amount);
        if (originTransactionId == null) {
            throw new InvalidLedgerEntryException("소멸 항목에는 원 적립 항목이 필요합니다.");
        }

        return PointsTransaction.builder()
                .transactionKey(expirationKey(originTransactionId))
                .memberId(memberId)
                .kind(TransactionKind.EXPIRE)
                .amount(TransactionKind.EXPIRE.signed(amount))
                .balanceAfter(balanceAfter)
                .createdAt(createdAt)
                .originTransactionId(originTransactionId)
                .build()
                .validate();
    }

    /**
     * 관리자 조정 (양수 지급 / 음수 차감)
     *
     * @param signedAmount 0이 아닌 조정 금액
     */
    public static PointsTransaction adminAdjust(
            Long memberId,
            long signedAmount,
            long balanceAfter,
            String actorId,
            String reason,
            String adminCapability,
            String idempotencyKey,
            LocalDateTime createdAt
    ) {
        TransactionKind kind = adminKindOf(signedAmount);

        return PointsTransaction.builder()
                .transactionKey(generateTransactionKey(kind, memberId, idempotencyKey))
                .memberId(memberId)
                .kind(kind)
                .amount(signedAmount)
                .balanceAfter(balanceAfter)
                .createdAt(createdAt)
                .actorId(actorId)
                .note(reason)
                .adminCapability(adminCapability)
                .build()
                .validate();
    }

    public static TransactionKind adminKindOf(long signedAmount) {
        if (signedAmount == 0) {
            throw new InvalidPointAmountException();
        }
        return signedAmount > 0 ? TransactionKind.ADMIN_AWARD : TransactionKind.ADMIN_DEDUCT;
    }

    private static void validateMagnitude(long amount) {
        if (amount <= 0 || amount > MAX_AMOUNT) {
            throw new InvalidPointAmountException();
        }
    }

    // 생성 시점의 공통 조건 검증
    private PointsTransaction validate() {
        if (memberId == null || memberId <= 0) {
            throw new InvalidLedgerEntryException("회원 ID 오류");
        }
        if (!kind.isConsistentWith(amount)) {
            throw new InvalidLedgerEntryException("금액 부호가 항목 종류와 맞지 않습니다. kind: " + kind);
        }
        if (balanceAfter < 0) {
            throw new InvalidLedgerEntryException("적용 후 잔액은 음수일 수 없습니다.");
        }
        if (createdAt == null) {
            throw new InvalidLedgerEntryException("기록 시각 누락");
        }
        if (transactionKey.endsWith(":null") || transactionKey.strip().endsWith(":")) {
            throw new InvalidLedgerEntryException("멱등키 누락");
        }
        if (kind != TransactionKind.EARN && expiresAt != null) {
            throw new InvalidLedgerEntryException("만료 시각은 적립 항목에만 기록합니다.");
        }
        if (kind.isAdmin() && (isBlank(actorId) || isBlank(note) || isBlank(adminCapability))) {
            throw new InvalidLedgerEntryException("관리자 조정에는 처리자, 사유, 권한 토큰이 필요합니다.");
        }
        return this;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
