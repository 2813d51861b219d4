package com.ureca.loyalty.point.service;

import com.ureca.loyalty.balance.entity.PointBalance;
import com.ureca.loyalty.balance.exception.InsufficientBalanceException;
import com.ureca.loyalty.balance.exception.NegativeBalanceException;
import com.ureca.loyalty.balance.service.BalanceProjector;
import com.ureca.loyalty.balance.service.BalanceSnapshot;
import com.ureca.loyalty.ledger.entity.PointLot;
import com.ureca.loyalty.ledger.entity.PointsTransaction;
import com.ureca.loyalty.ledger.entity.TransactionKind;
import com.ureca.loyalty.ledger.repository.PointLotRepository;
import com.ureca.loyalty.ledger.service.AppendResult;
import com.ureca.loyalty.ledger.service.LedgerRecorder;
import com.ureca.loyalty.ledger.service.LotAllocation;
import com.ureca.loyalty.ledger.service.LotAllocator;
import com.ureca.loyalty.point.dto.MutationResult;
import com.ureca.loyalty.tier.service.TierService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 모든 포인트 변경의 공통 경로
 * <p>
 * MemberLockExecutor 의 잠금 구간 안에서 호출된다
 * 1. 멱등키 선조회 (중복이면 이전 결과)
 * 2. 잔액 투영 계산 (음수면 거절)
 * 3. 원장 기록
 * 4. 잔액 반영 + 포인트 묶음 갱신
 * 5. 등급 재계산
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PointMutationProcessor {

    private final LedgerRecorder ledgerRecorder;
    private final BalanceProjector balanceProjector;
    private final PointLotRepository pointLotRepository;
    private final LotAllocator lotAllocator;
    private final TierService tierService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // 반영 후 잔액, 기록 시각으로 원장 항목 생성
    @FunctionalInterface
    public interface EntryFactory {
        PointsTransaction create(long balanceAfter, LocalDateTime now);
    }

    /**
     * @param balance        잠금 획득한 잔액 행
     * @param kind           원장 항목 종류
     * @param delta          부호 포함 변화량
     * @param transactionKey 멱등키
     * @param entryFactory   원장 항목 생성
     * @return 처리 결과
     * @throws InsufficientBalanceException 반영 후 잔액 음수
     */
    public MutationResult apply(
            PointBalance balance,
            TransactionKind kind,
            long delta,
            String transactionKey,
            EntryFactory entryFactory
    ) {
        Optional<PointsTransaction> prior = ledgerRecorder.findByTransactionKey(transactionKey);
        if (prior.isPresent()) {
            log.warn("[포인트 변경] 이미 처리된 요청. 이전 결과 반환. transactionKey : {}", transactionKey);
            return duplicateOf(prior.get());
        }

        LocalDateTime now = LocalDateTime.now(clock);

        // 잠근 행의 버전을 그대로 넘긴다. 다른 트랜잭션과의 버전 충돌은 FOR UPDATE 잠금과
        // flush 시점의 @Version 검사가 막고, ObjectOptimisticLockingFailureException 은 MemberLockExecutor 가 재시도
        BalanceSnapshot snapshot;
        try {
            snapshot = balanceProjector.apply(balance, delta, balance.getVersion(), now);
        } catch (NegativeBalanceException e) {
            count(kind, "rejected");
            log.warn("[포인트 변경] 잔액 부족 거절. memberId : {}, kind : {}, balance : {}, delta : {}",
                    balance.getMemberId(), kind, e.getCurrentBalance(), delta);
            throw new InsufficientBalanceException(e.getCurrentBalance(), Math.abs(delta));
        }

        AppendResult result = ledgerRecorder.append(entryFactory.create(snapshot.balance(), now));
        if (result.isDuplicate()) {
            return duplicateOf(result.transaction());
        }

        PointsTransaction entry = result.transaction();
        balance.apply(snapshot);
        updateLots(entry, now);
        String tier = tierService.reassess(balance, now);

        count(kind, "applied");
        log.info("[포인트 변경] 반영 완료. memberId : {}, kind : {}, amount : {}, balance : {}, tier : {}",
                entry.getMemberId(), kind, entry.getAmount(), snapshot.balance(), tier);

        return MutationResult.applied(entry.getId(), snapshot.balance(), tier);
    }

    private void updateLots(PointsTransaction entry, LocalDateTime now) {
        switch (entry.getKind()) {
            case EARN, ADMIN_AWARD -> pointLotRepository.save(PointLot.open(entry));
            case REDEEM, ADMIN_DEDUCT -> consumeLots(entry.getMemberId(), -entry.getAmount(), now);
            case EXPIRE -> expireLot(entry);
        }
    }

    private void consumeLots(Long memberId, long amount, LocalDateTime now) {
        List<LotAllocation> allocations = lotAllocator.allocate(pointLotRepository.findOpenLots(memberId), amount, now);
        for (LotAllocation allocation : allocations) {
            allocation.lot().consume(allocation.amount());
        }
        log.debug("[포인트 변경] 묶음 차감. memberId : {}, amount : {}, lots : {}", memberId, amount, allocations.size());
    }

    private void expireLot(PointsTransaction entry) {
        PointLot lot = pointLotRepository.findByTransactionId(entry.getOriginTransactionId())
                .orElseThrow(() -> new IllegalStateException(
                        "소멸 대상 포인트 묶음이 없습니다. transactionId: " + entry.getOriginTransactionId()));

        long expired = lot.expire();
        if (expired != -entry.getAmount()) {
            throw new IllegalStateException("소멸 금액과 묶음 잔여 포인트가 다릅니다. lotId: " + lot.getId());
        }
    }

    private MutationResult duplicateOf(PointsTransaction prior) {
        count(prior.getKind(), "duplicate");
        return MutationResult.duplicate(
                prior.getId(),
                prior.getBalanceAfter(),
                tierService.tierOf(prior.getBalanceAfter())
        );
    }

    private void count(TransactionKind kind, String result) {
        Counter.builder("loyalty_ledger_mutation_total")
                .tag("kind", kind.name())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
