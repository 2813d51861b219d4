package com.ureca.loyalty.expiration.scheduler;

import com.ureca.loyalty.common.notification.LoyaltyAlertService;
import com.ureca.loyalty.config.LoyaltyProperties;
import com.ureca.loyalty.expiration.dto.MemberExpiration;
import com.ureca.loyalty.expiration.dto.SweepResult;
import com.ureca.loyalty.expiration.service.ExpirationProcessor;
import com.ureca.loyalty.ledger.repository.PointLotRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 만료 포인트 소멸 배치
 * <p>
 * 만료 시각이 지난 묶음을 가진 회원을 memberId 순으로 나눠 처리
 * 회원 단위로 독립 트랜잭션이라 한 회원 실패가 배치를 멈추지 않는다
 * 같은 시각 기준 재실행은 추가 기록 없음
 */
@Slf4j
@Component
public class ExpirationSweeper {

    private final ExpirationProcessor expirationProcessor;
    private final PointLotRepository pointLotRepository;
    private final LoyaltyAlertService alertService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int batchSize;

    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);

    public ExpirationSweeper(
            ExpirationProcessor expirationProcessor,
            PointLotRepository pointLotRepository,
            LoyaltyAlertService alertService,
            MeterRegistry meterRegistry,
            Clock clock,
            LoyaltyProperties properties
    ) {
        this.expirationProcessor = expirationProcessor;
        this.pointLotRepository = pointLotRepository;
        this.alertService = alertService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.batchSize = properties.sweep().batchSize();
    }

    @PreDestroy
    public void shutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("[포인트 소멸] 종료 요청. 진행 중인 회원 처리 후 중단");
        }
    }

    @Scheduled(cron = "${loyalty.sweep.cron}")
    @SchedulerLock(name = "loyaltyExpirationSweep", lockAtMostFor = "PT30M")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * 소멸 배치 실행
     * 수동 실행(API)도 이 메소드를 쓴다
     *
     * @return 배치 결과
     */
    public SweepResult sweep() {
        LocalDateTime now = LocalDateTime.now(clock);
        log.info("[포인트 소멸] 배치 시작. 기준 시각 : {}", now);

        int expiredCount = 0;
        long expiredPoints = 0;
        int processedMembers = 0;
        int failedMembers = 0;

        Long cursor = 0L;
        while (!shutdownRequested.get()) {
            List<Long> memberIds = pointLotRepository.findMemberIdsWithExpiredLots(
                    now, cursor, PageRequest.of(0, batchSize));

            if (memberIds.isEmpty()) {
                break;
            }

            for (Long memberId : memberIds) {
                try {
                    MemberExpiration expiration = expirationProcessor.expireMember(memberId, now);
                    expiredCount += expiration.appendedCount();
                    expiredPoints += expiration.expiredPoints();
                    processedMembers++;

                } catch (Exception e) {
                    failedMembers++;
                    log.error("[포인트 소멸] 회원 처리 실패. 다음 회원 진행. memberId : {}, error : {}",
                            memberId, e.getMessage(), e);
                    alertService.alertSweepMemberFailure(memberId, e.getMessage());
                }
            }

            cursor = memberIds.get(memberIds.size() - 1);
        }

        Counter.builder("loyalty_expired_points_total")
                .register(meterRegistry)
                .increment(expiredPoints);
        Counter.builder("loyalty_sweep_runs_total")
                .tag("result", failedMembers == 0 ? "success" : "partial_failure")
                .register(meterRegistry)
                .increment();

        log.info("[포인트 소멸] 배치 완료. 소멸 건수 : {}, 소멸 포인트 : {}, 처리 회원 : {}, 실패 회원 : {}",
                expiredCount, expiredPoints, processedMembers, failedMembers);

        return new SweepResult(expiredCount, expiredPoints, processedMembers, failedMembers);
    }
}
