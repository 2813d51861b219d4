package com.ureca.loyalty.expiration.service;

import com.ureca.loyalty.concurrency.MemberLockExecutor;
import com.ureca.loyalty.expiration.dto.MemberExpiration;
import com.ureca.loyalty.ledger.entity.PointLot;
import com.ureca.loyalty.ledger.entity.PointsTransaction;
import com.ureca.loyalty.ledger.entity.TransactionKind;
import com.ureca.loyalty.ledger.repository.PointLotRepository;
import com.ureca.loyalty.point.dto.MutationResult;
import com.ureca.loyalty.point.service.PointMutationProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 회원 한 명의 만료 포인트 소멸
 * 회원 잠금 구간 안에서 만료된 묶음마다 EXPIRE 항목 하나씩 기록
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpirationProcessor {

    private final MemberLockExecutor memberLockExecutor;
    private final PointMutationProcessor mutationProcessor;
    private final PointLotRepository pointLotRepository;

    /**
     * @param memberId 회원 ID
     * @param now      만료 기준 시각
     * @return 소멸 결과 (대상이 없으면 0건)
     */
    public MemberExpiration expireMember(Long memberId, LocalDateTime now) {
        return memberLockExecutor.execute(memberId, balance -> {
            List<PointLot> expiredLots = pointLotRepository.findExpiredOpenLots(memberId, now);

            int appendedCount = 0;
            long expiredPoints = 0;

            for (PointLot lot : expiredLots) {
                long remaining = lot.getRemainingAmount();
                Long originTransactionId = lot.getTransactionId();

                MutationResult result = mutationProcessor.apply(
                        balance,
                        TransactionKind.EXPIRE,
                        -remaining,
                        PointsTransaction.expirationKey(originTransactionId),
                        (balanceAfter, at) -> PointsTransaction.expire(
                                memberId, originTransactionId, remaining, balanceAfter, at
                        )
                );

                if (!result.duplicate()) {
                    appendedCount++;
                    expiredPoints += remaining;
                }
            }

            if (appendedCount > 0) {
                log.info("[포인트 소멸] 회원 처리 완료. memberId : {}, 소멸 건수 : {}, 소멸 포인트 : {}",
                        memberId, appendedCount, expiredPoints);
            }
            return new MemberExpiration(memberId, appendedCount, expiredPoints);
        });
    }
}
