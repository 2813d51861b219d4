package com.ureca.loyalty.common.notification;

import com.ureca.loyalty.common.notification.dto.SlackMessage;
import com.ureca.loyalty.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * 운영자 Slack 알림 전송
 * <p>
 * 알림 전용 Executor 에서 비동기 실행
 * RestClientException 시 최대 3회, 1초 간격 재시도
 */
@Slf4j
@Component
public class SlackNotifier {

    private final RestClient restClient;

    public SlackNotifier(
            RestClient.Builder restClientBuilder,
            @Value("${slack.webhook.url}") String webhookUrl
    ) {
        this.restClient = restClientBuilder
                .baseUrl(webhookUrl)
                .build();
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR_NAME)
    @Retryable(
            retryFor = {RestClientException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000)
    )
    public void sendAsync(SlackMessage message) {
        restClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .body(message)
                .retrieve()
                .toBodilessEntity();

        log.info("[Slack] 메시지 전송 완료. text : {}", message.text());
    }

    // 알림 실패는 원장 처리 결과에 영향 없어서 로그만
    @Recover
    public void recover(RestClientException e, SlackMessage message) {
        log.error("[Slack] 메시지 전송 3회 재시도 후 최종 실패. error : {}, message : {}",
                e.getMessage(), message.text());
    }
}
