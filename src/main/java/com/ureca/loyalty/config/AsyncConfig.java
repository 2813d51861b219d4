package com.ureca.loyalty.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 비동기 처리를 위한 Executor 설정
 * <p>
 * Executor 분리 전략
 * Outbox 이벤트 발행 AFTER_COMMIT 리스너가 사용
 * Slack 알림
 */
@Slf4j
@Configuration
@EnableAsync
@EnableRetry
@EnableConfigurationProperties(LoyaltyProperties.class)
public class AsyncConfig {
    public static final String EVENT_EXECUTOR_NAME = "eventAsyncExecutor";
    public static final String NOTIFICATION_EXECUTOR_NAME = "notificationAsyncExecutor";

    /**
     * Outbox 이벤트 발행 전용 Executor
     * <p>
     * 큐가 가득차면 호출 쓰레드가 직접 실행
     * 배포 시 전송 중이던 이벤트 10초 대기
     */
    @Bean(name = EVENT_EXECUTOR_NAME)
    public Executor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("LoyaltyEvent-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();

        log.info("[비동기] Event Executor 초기화 완료");
        return executor;
    }

    /**
     * Slack 알림 전용 Executor
     * <p>
     * 알림 실패는 원장에 영향 없으므로 큐가 차면 버림
     */
    @Bean(name = NOTIFICATION_EXECUTOR_NAME)
    public Executor notificationAsyncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("Notification-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();

        log.info("[비동기] Slack Executor 초기화 완료");
        return executor;
    }
}
