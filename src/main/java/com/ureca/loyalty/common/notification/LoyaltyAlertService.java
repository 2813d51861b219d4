package com.ureca.loyalty.common.notification;

import com.ureca.loyalty.common.notification.dto.SlackAttachment;
import com.ureca.loyalty.common.notification.dto.SlackField;
import com.ureca.loyalty.common.notification.dto.SlackMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 포인트 원장 운영 알림 서비스
 * <p>
 * 잠금 대기 초과, 소멸 배치 회원 단위 실패 등
 * 운영자 확인이 필요한 상황만 Slack 으로 전송
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoyaltyAlertService {

    private final SlackNotifier slackNotifier;

    /**
     * 회원 잔액 행 잠금 대기 초과
     * 강제 해제는 하지 않고 운영자에게 점유 트랜잭션 확인 요청
     *
     * @param memberId     회원 ID
     * @param errorMessage DB 에러 메시지
     */
    public void alertLockTimeout(Long memberId, String errorMessage) {
        List<SlackField> fields = List.of(
                SlackField.of("Member ID", String.valueOf(memberId)),
                SlackField.longField("DB Error", errorMessage),
                SlackField.longField("조치",
                        """
                                1. point_balance 행을 점유 중인 장기 트랜잭션 확인
                                2. 강제 해제 금지, 점유 세션 종료 여부는 수동 판단
                                3. 요청은 부작용 없이 중단되었으므로 같은 멱등키로 재시도 가능
                                """)
        );
        SlackAttachment attachment = SlackAttachment.warning(fields);
        SlackMessage message = SlackMessage.of("포인트 원장: 회원 잠금 획득 시간 초과", attachment);

        log.error("[포인트 잠금] 잠금 대기 초과 알림. memberId : {}", memberId);
        slackNotifier.sendAsync(message);
    }

    /**
     * 만료 포인트 소멸 배치 중 한 회원 처리 실패
     * 배치는 계속 진행되고 다음 배치에서 재시도됨
     */
    public void alertSweepMemberFailure(Long memberId, String errorMessage) {
        List<SlackField> fields = List.of(
                SlackField.of("Member ID", String.valueOf(memberId)),
                SlackField.longField("Error", errorMessage),
                SlackField.longField("조치", "다음 소멸 배치에서 자동 재시도. 반복 실패 시 point_lot 상태 확인")
        );
        SlackAttachment attachment = SlackAttachment.danger(fields);
        SlackMessage message = SlackMessage.of("포인트 소멸: 회원 처리 실패", attachment);

        log.error("[포인트 소멸] 회원 처리 실패 알림. memberId : {}", memberId);
        slackNotifier.sendAsync(message);
    }

    /**
     * 등급 변경 이벤트 재발행 한도 도달
     * 원장과 등급은 이미 반영되어 있고, 외부 소비자만 변경을 받지 못한 상태
     */
    public void alertEventRetryExhausted(Long memberId, String eventType, String eventId, String errorMessage) {
        List<SlackField> fields = List.of(
                SlackField.of("Member ID", String.valueOf(memberId)),
                SlackField.of("Event", eventType),
                SlackField.longField("Event ID", eventId),
                SlackField.longField("Error", errorMessage),
                SlackField.longField("조치", "브로커 상태 확인 후 outbox 행을 SEND_FAIL, retry_count 0 으로 되돌리면 다음 주기에 재발행")
        );
        SlackAttachment attachment = SlackAttachment.danger(fields);
        SlackMessage message = SlackMessage.of("포인트 이벤트: 재발행 한도 도달", attachment);

        log.error("[이벤트 재발행] 한도 도달 알림. memberId : {}, eventId : {}", memberId, eventId);
        slackNotifier.sendAsync(message);
    }
}
