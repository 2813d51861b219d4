package com.ureca.loyalty.concurrency;

import com.ureca.loyalty.balance.entity.PointBalance;
import com.ureca.loyalty.balance.exception.StaleVersionException;
import com.ureca.loyalty.balance.repository.PointBalanceRepository;
import com.ureca.loyalty.common.exception.StorageUnavailableException;
import com.ureca.loyalty.common.notification.LoyaltyAlertService;
import com.ureca.loyalty.concurrency.exception.BusyException;
import com.ureca.loyalty.concurrency.exception.LockAcquisitionTimeoutException;
import com.ureca.loyalty.config.LoyaltyProperties;
import com.ureca.loyalty.tier.domain.TierThresholds;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Function;

/**
 * 회원 단위 직렬화 실행기
 * <p>
 * 새 트랜잭션에서 회원 잔액 행을 SELECT ... FOR UPDATE 로 잠근 뒤 작업 실행
 * 같은 회원은 잠금 획득 순서대로, 다른 회원은 병렬로 처리된다
 * <p>
 * 재시도: 버전 충돌, 낙관적 락 실패, 중복키 경합 (기본 3회, 50ms 부터 2배)
 * 재시도 소진 -> BusyException
 * 잠금 대기 초과 -> LockAcquisitionTimeoutException + 운영자 알림 (강제 해제 없음)
 * DB 접근 불가 -> StorageUnavailableException
 */
@Slf4j
@Component
public class MemberLockExecutor {

    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate retryTemplate;
    private final PointBalanceRepository pointBalanceRepository;
    private final TierThresholds tierThresholds;
    private final LoyaltyAlertService alertService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxAttempts;

    public MemberLockExecutor(
            PlatformTransactionManager transactionManager,
            PointBalanceRepository pointBalanceRepository,
            TierThresholds tierThresholds,
            LoyaltyAlertService alertService,
            MeterRegistry meterRegistry,
            Clock clock,
            LoyaltyProperties properties
    ) {
        LoyaltyProperties.ConcurrencyPolicy policy = properties.concurrency();

        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(policy.maxAttempts())
                .exponentialBackoff(policy.delay(), policy.multiplier(), policy.delay() * 20)
                .retryOn(List.of(
                        StaleVersionException.class,
                        ObjectOptimisticLockingFailureException.class,
                        DataIntegrityViolationException.class
                ))
                .traversingCauses()
                .build();

        this.pointBalanceRepository = pointBalanceRepository;
        this.tierThresholds = tierThresholds;
        this.alertService = alertService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxAttempts = policy.maxAttempts();
    }

    /**
     * 회원 잠금 구간에서 작업 실행
     *
     * @param memberId 회원 ID
     * @param work     잠긴 잔액 행을 받아 실행할 작업 (같은 트랜잭션)
     * @return 작업 결과
     * @throws BusyException                   재시도 소진
     * @throws LockAcquisitionTimeoutException 잠금 대기 초과
     * @throws StorageUnavailableException     DB 접근 불가
     */
    public <T> T execute(Long memberId, Function<PointBalance, T> work) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("[포인트 잠금] 충돌 재시도. memberId : {}, attempt : {}, cause : {}",
                            memberId, context.getRetryCount() + 1, context.getLastThrowable().getMessage());
                }
                return transactionTemplate.execute(status -> work.apply(lockBalance(memberId)));
            });

        } catch (StaleVersionException | ObjectOptimisticLockingFailureException
                 | DataIntegrityViolationException e) {
            log.warn("[포인트 잠금] 재시도 소진. memberId : {}, attempts : {}, cause : {}",
                    memberId, maxAttempts, e.getMessage());
            throw new BusyException(memberId, maxAttempts);

        } catch (PessimisticLockingFailureException e) {
            Counter.builder("loyalty_lock_timeout_total")
                    .register(meterRegistry)
                    .increment();
            log.error("[포인트 잠금] 잠금 대기 초과. 요청 중단. memberId : {}, error : {}", memberId, e.getMessage());
            alertService.alertLockTimeout(memberId, e.getMessage());
            throw new LockAcquisitionTimeoutException(memberId, e);

        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            log.error("[포인트 잠금] 저장소 접근 불가. memberId : {}, error : {}", memberId, e.getMessage());
            throw new StorageUnavailableException("포인트 저장소 접근 불가. memberId: " + memberId, e);
        }
    }

    // 잔액 행 잠금, 첫 거래면 생성 (삽입한 행은 커밋까지 이 트랜잭션이 점유)
    private PointBalance lockBalance(Long memberId) {
        return pointBalanceRepository.findByMemberIdWithLock(memberId)
                .orElseGet(() -> {
                    log.debug("[포인트 잠금] 잔액 행 생성. memberId : {}", memberId);
                    return pointBalanceRepository.saveAndFlush(PointBalance.open(
                            memberId,
                            tierThresholds.lowest().tierName(),
                            LocalDateTime.now(clock)
                    ));
                });
    }
}
