package com.ureca.loyalty.adjustment.service;

import com.ureca.loyalty.adjustment.exception.InvalidAdjustmentException;
import com.ureca.loyalty.concurrency.MemberLockExecutor;
import com.ureca.loyalty.ledger.entity.PointsTransaction;
import com.ureca.loyalty.ledger.entity.TransactionKind;
import com.ureca.loyalty.point.dto.MutationResult;
import com.ureca.loyalty.point.service.PointMutationProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminAdjustmentServiceImpl implements AdminAdjustmentService {

    private final MemberLockExecutor memberLockExecutor;
    private final PointMutationProcessor mutationProcessor;

    @Override
    public MutationResult adminAdjust(Long memberId, long amount, String actorId, String reason,
                                      String idempotencyKey, String capabilityToken) {
        validate(amount, actorId, reason, idempotencyKey, capabilityToken);

        TransactionKind kind = PointsTransaction.adminKindOf(amount);
        String transactionKey = PointsTransaction.generateTransactionKey(kind, memberId, idempotencyKey);

        log.info("[관리자 조정] 시작. memberId : {}, amount : {}, actorId : {}, reason : {}",
                memberId, amount, actorId, reason);

        MutationResult result = memberLockExecutor.execute(memberId, balance ->
                mutationProcessor.apply(balance, kind, amount, transactionKey,
                        (balanceAfter, now) -> PointsTransaction.adminAdjust(
                                memberId, amount, balanceAfter, actorId, reason,
                                capabilityToken, idempotencyKey, now
                        ))
        );

        log.info("[관리자 조정] 완료. memberId : {}, kind : {}, balance : {}, duplicate : {}",
                memberId, kind, result.balance(), result.duplicate());
        return result;
    }

    private void validate(long amount, String actorId, String reason,
                          String idempotencyKey, String capabilityToken) {
        if (amount == 0) {
            throw new InvalidAdjustmentException("조정 포인트는 0일 수 없습니다.");
        }
        if (amount > PointsTransaction.MAX_AMOUNT || amount < -PointsTransaction.MAX_AMOUNT) {
            throw new InvalidAdjustmentException(
                    "조정 포인트는 " + PointsTransaction.MAX_AMOUNT + " 를 넘을 수 없습니다.");
        }
        if (isBlank(actorId)) {
            throw new InvalidAdjustmentException("처리 관리자 ID가 필요합니다.");
        }
        if (isBlank(reason)) {
            throw new InvalidAdjustmentException("조정 사유가 필요합니다.");
        }
        if (reason.length() > PointsTransaction.MAX_NOTE_LENGTH) {
            throw new InvalidAdjustmentException(
                    "조정 사유는 " + PointsTransaction.MAX_NOTE_LENGTH + "자를 넘을 수 없습니다.");
        }
        if (isBlank(idempotencyKey)) {
            throw new InvalidAdjustmentException("멱등키가 필요합니다.");
        }
        if (isBlank(capabilityToken)) {
            throw new InvalidAdjustmentException("관리자 권한 토큰이 필요합니다.");
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
