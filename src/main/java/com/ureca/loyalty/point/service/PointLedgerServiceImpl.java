package com.ureca.loyalty.point.service;

import com.ureca.loyalty.balance.entity.PointBalance;
import com.ureca.loyalty.balance.repository.PointBalanceRepository;
import com.ureca.loyalty.common.PageResult;
import com.ureca.loyalty.concurrency.MemberLockExecutor;
import com.ureca.loyalty.config.LoyaltyProperties;
import com.ureca.loyalty.ledger.dto.KindTotal;
import com.ureca.loyalty.ledger.dto.TransactionResponse;
import com.ureca.loyalty.ledger.entity.PointsTransaction;
import com.ureca.loyalty.ledger.entity.TransactionKind;
import com.ureca.loyalty.ledger.exception.InvalidPointAmountException;
import com.ureca.loyalty.ledger.exception.InvalidTtlException;
import com.ureca.loyalty.ledger.repository.PointsTransactionRepository;
import com.ureca.loyalty.point.dto.BalanceResponse;
import com.ureca.loyalty.point.dto.MutationResult;
import com.ureca.loyalty.point.dto.SummaryResponse;
import com.ureca.loyalty.tier.service.TierService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 포인트 적립 / 사용 / 조회
 * 변경은 MemberLockExecutor 가 트랜잭션을 열고, 조회는 잠금 없이 읽기 전용
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PointLedgerServiceImpl implements PointLedgerService {

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;

    private final MemberLockExecutor memberLockExecutor;
    private final PointMutationProcessor mutationProcessor;
    private final PointBalanceRepository pointBalanceRepository;
    private final PointsTransactionRepository pointsTransactionRepository;
    private final TierService tierService;
    private final LoyaltyProperties loyaltyProperties;
    private final Clock clock;

    @Override
    public MutationResult earn(Long memberId, long amount, String sourceRef, String idempotencyKey, Integer ttlDays) {
        validatePositive(amount);
        int ttl = resolveTtlDays(ttlDays);

        log.info("[포인트 적립] 시작. memberId : {}, amount : {}, ttlDays : {}, idempotencyKey : {}",
                memberId, amount, ttl, idempotencyKey);

        String transactionKey = PointsTransaction.generateTransactionKey(TransactionKind.EARN, memberId, idempotencyKey);

        MutationResult result = memberLockExecutor.execute(memberId, balance ->
                mutationProcessor.apply(balance, TransactionKind.EARN, amount, transactionKey,
                        (balanceAfter, now) -> PointsTransaction.earn(
                                memberId, amount, balanceAfter, sourceRef, idempotencyKey, now, now.plusDays(ttl)
                        ))
        );

        log.info("[포인트 적립] 완료. memberId : {}, balance : {}, tier : {}, duplicate : {}",
                memberId, result.balance(), result.tier(), result.duplicate());
        return result;
    }

    @Override
    public MutationResult redeem(Long memberId, long amount, String sourceRef, String idempotencyKey) {
        validatePositive(amount);

        log.info("[포인트 사용] 시작. memberId : {}, amount : {}, idempotencyKey : {}", memberId, amount, idempotencyKey);

        String transactionKey = PointsTransaction.generateTransactionKey(TransactionKind.REDEEM, memberId, idempotencyKey);

        MutationResult result = memberLockExecutor.execute(memberId, balance ->
                mutationProcessor.apply(balance, TransactionKind.REDEEM, -amount, transactionKey,
                        (balanceAfter, now) -> PointsTransaction.redeem(
                                memberId, amount, balanceAfter, sourceRef, idempotencyKey, now
                        ))
        );

        log.info("[포인트 사용] 완료. memberId : {}, balance : {}, tier : {}, duplicate : {}",
                memberId, result.balance(), result.tier(), result.duplicate());
        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public BalanceResponse getBalance(Long memberId) {
        Optional<PointBalance> found = pointBalanceRepository.findById(memberId);

        long balance = found.map(PointBalance::getCurrentBalance).orElse(0L);
        String tier = found.map(PointBalance::getTierName).orElseGet(() -> tierService.tierOf(0));
        LocalDateTime asOf = found.map(PointBalance::getUpdatedAt).orElseGet(() -> LocalDateTime.now(clock));

        return BalanceResponse.of(memberId, balance, tier, asOf, tierService.progressOf(balance));
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<TransactionResponse> getHistory(Long memberId, int page, int size, TransactionKind kind) {
        int pageNumber = Math.max(page, 1);
        int pageSize = size < 1 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);

        return PageResult.from(
                pointsTransactionRepository.findHistory(memberId, kind, PageRequest.of(pageNumber - 1, pageSize)),
                TransactionResponse::from
        );
    }

    @Override
    @Transactional(readOnly = true)
    public SummaryResponse getSummary(Long memberId) {
        long totalEarned = 0;
        long totalRedeemed = 0;
        long totalExpired = 0;
        long totalAdjusted = 0;
        long transactionCount = 0;

        for (KindTotal total : pointsTransactionRepository.sumAmountGroupByKind(memberId)) {
            long sum = total.amountSum() == null ? 0 : total.amountSum();
            transactionCount += total.count();

            switch (total.kind()) {
                case EARN -> totalEarned += sum;
                case REDEEM -> totalRedeemed += -sum;
                case EXPIRE -> totalExpired += -sum;
                case ADMIN_AWARD, ADMIN_DEDUCT -> totalAdjusted += sum;
            }
        }

        long currentBalance = pointBalanceRepository.findById(memberId)
                .map(PointBalance::getCurrentBalance)
                .orElse(0L);

        LocalDateTime lastTransactionAt = pointsTransactionRepository
                .findTopByMemberIdOrderByCreatedAtDescIdDesc(memberId)
                .map(PointsTransaction::getCreatedAt)
                .orElse(null);

        return new SummaryResponse(memberId, totalEarned, totalRedeemed, totalExpired, totalAdjusted,
                currentBalance, transactionCount, lastTransactionAt);
    }

    private int resolveTtlDays(Integer ttlDays) {
        int ttl = ttlDays != null ? ttlDays : loyaltyProperties.earn().defaultTtlDays();
        if (ttl < 1) {
            throw new InvalidTtlException();
        }
        return ttl;
    }

    private void validatePositive(long amount) {
        if (amount <= 0 || amount > PointsTransaction.MAX_AMOUNT) {
            throw new InvalidPointAmountException();
        }
    }
}
