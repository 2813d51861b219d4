package com.ureca.loyalty.common.notification;

import com.ureca.loyalty.common.notification.dto.SlackField;
import com.ureca.loyalty.common.notification.dto.SlackMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class LoyaltyAlertServiceTest {

    @Mock
    private SlackNotifier slackNotifier;

    @InjectMocks
    private LoyaltyAlertService loyaltyAlertService;

    @Test
    @DisplayName("잠금 대기 초과 : warning 색상, 회원 ID 와 DB 에러 포함")
    void alertLockTimeout() {
        // when
        loyaltyAlertService.alertLockTimeout(7L, "Lock wait timeout exceeded");

        // then
        ArgumentCaptor<SlackMessage> captor = ArgumentCaptor.forClass(SlackMessage.class);
        then(slackNotifier).should().sendAsync(captor.capture());

        SlackMessage message = captor.getValue();
        assertThat(message.text()).contains("잠금 획득 시간 초과");
        assertThat(message.attachments().get(0).color()).isEqualTo("warning");
        assertThat(message.attachments().get(0).fields())
                .extracting(SlackField::value)
                .contains("7", "Lock wait timeout exceeded");
    }

    @Test
    @DisplayName("소멸 회원 실패 : danger 색상")
    void alertSweepMemberFailure() {
        // when
        loyaltyAlertService.alertSweepMemberFailure(9L, "boom");

        // then
        ArgumentCaptor<SlackMessage> captor = ArgumentCaptor.forClass(SlackMessage.class);
        then(slackNotifier).should().sendAsync(captor.capture());

        assertThat(captor.getValue().attachments().get(0).color()).isEqualTo("danger");
        assertThat(captor.getValue().attachments().get(0).fields())
                .extracting(SlackField::value)
                .contains("9", "boom");
    }

    @Test
    @DisplayName("이벤트 재발행 한도 : danger 색상, 회원 ID 와 이벤트 ID 포함")
    void alertEventRetryExhausted() {
        // when
        loyaltyAlertService.alertEventRetryExhausted(42L, "TierChangedEvent", "event-uuid-001", "broker down");

        // then
        ArgumentCaptor<SlackMessage> captor = ArgumentCaptor.forClass(SlackMessage.class);
        then(slackNotifier).should().sendAsync(captor.capture());

        assertThat(captor.getValue().text()).contains("재발행 한도");
        assertThat(captor.getValue().attachments().get(0).color()).isEqualTo("danger");
        assertThat(captor.getValue().attachments().get(0).fields())
                .extracting(SlackField::value)
                .contains("42", "TierChangedEvent", "event-uuid-001", "broker down");
    }
}
