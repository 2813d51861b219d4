package com.ureca.loyalty.ledger.service;

import com.ureca.loyalty.ledger.entity.PointsTransaction;
import com.ureca.loyalty.ledger.repository.PointsTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 원장 기록 구현체
 * <p>
 * 키 선조회로 일반적인 재시도를 걸러내고
 * 동시 중복은 유니크 제약 위반(DataIntegrityViolationException)으로 전파되어
 * 호출자 트랜잭션 전체가 롤백된다. 재시도 시 선조회에서 ALREADY_APPLIED
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class LedgerRecorderImpl implements LedgerRecorder {

    private final PointsTransactionRepository pointsTransactionRepository;

    @Override
    public AppendResult append(PointsTransaction transaction) {
        String transactionKey = transaction.getTransactionKey();

        Optional<PointsTransaction> existing = pointsTransactionRepository.findByTransactionKey(transactionKey);
        if (existing.isPresent()) {
            log.warn("[원장 기록] 중복 요청 (멱등성). transactionKey : {}", transactionKey);
            return AppendResult.alreadyApplied(existing.get());
        }

        PointsTransaction saved = pointsTransactionRepository.saveAndFlush(transaction);
        log.info("[원장 기록] 저장 완료. transactionId : {}, kind : {}, amount : {}, balanceAfter : {}",
                saved.getId(), saved.getKind(), saved.getAmount(), saved.getBalanceAfter());

        return AppendResult.applied(saved);
    }

    @Override
    public Optional<PointsTransaction> findByTransactionKey(String transactionKey) {
        return pointsTransactionRepository.findByTransactionKey(transactionKey);
    }
}
