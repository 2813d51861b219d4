package com.ureca.loyalty.ledger.entity;

import com.ureca.loyalty.ledger.exception.InvalidLedgerEntryException;
import com.ureca.loyalty.ledger.exception.InvalidPointAmountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.ureca.loyalty.support.fixture.LedgerFixture.BASE_TIME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PointsTransaction 엔티티 단위 테스트")
class PointsTransactionTest {

    private static final Long MEMBER_ID = 7L;

    @Nested
    @DisplayName("earn 팩토리")
    class EarnTest {

        @Test
        @DisplayName("성공 : 양수 금액, 만료 시각, 회원 포함 멱등키")
        void earn_valid() {
            // when
            PointsTransaction earn = PointsTransaction.earn(
                    MEMBER_ID, 100, 100, "booking-1", "k1", BASE_TIME, BASE_TIME.plusDays(30));

            // then
            assertThat(earn.getKind()).isEqualTo(TransactionKind.EARN);
            assertThat(earn.getAmount()).isEqualTo(100L);
            assertThat(earn.getExpiresAt()).isEqualTo(BASE_TIME.plusDays(30));
            assertThat(earn.getTransactionKey()).isEqualTo("EARN:7:k1");
        }

        @Test
        @DisplayName("실패 : 0 이하 금액")
        void earn_zeroAmount_throws() {
            assertThatThrownBy(() -> PointsTransaction.earn(
                    MEMBER_ID, 0, 0, null, "k1", BASE_TIME, BASE_TIME.plusDays(1)))
                    .isInstanceOf(InvalidPointAmountException.class);
        }

        @Test
        @DisplayName("실패 : 만료 시각이 적립 시각 이전")
        void earn_expiresBeforeCreated_throws() {
            assertThatThrownBy(() -> PointsTransaction.earn(
                    MEMBER_ID, 10, 10, null, "k1", BASE_TIME, BASE_TIME))
                    .isInstanceOf(InvalidLedgerEntryException.class);
        }

        @Test
        @DisplayName("실패 : 멱등키 누락")
        void earn_nullKey_throws() {
            assertThatThrownBy(() -> PointsTransaction.earn(
                    MEMBER_ID, 10, 10, null, null, BASE_TIME, BASE_TIME.plusDays(1)))
                    .isInstanceOf(InvalidLedgerEntryException.class);
        }
    }

    @Nested
    @DisplayName("redeem / expire 팩토리")
    class DebitTest {

        @Test
        @DisplayName("성공 : 사용은 음수 금액으로 기록")
        void redeem_negativeAmount() {
            // when
            PointsTransaction redeem = PointsTransaction.redeem(MEMBER_ID, 40, 60, "order-1", "r1", BASE_TIME);

            // then
            assertThat(redeem.getAmount()).isEqualTo(-40L);
            assertThat(redeem.getExpiresAt()).isNull();
            assertThat(redeem.getTransactionKey()).isEqualTo("REDEEM:7:r1");
        }

        @Test
        @DisplayName("성공 : 소멸 키는 원 적립 항목 기준")
        void expire_keyedByOrigin() {
            // when
            PointsTransaction expire = PointsTransaction.expire(MEMBER_ID, 11L, 30, 0, BASE_TIME);

            // then
            assertThat(expire.getAmount()).isEqualTo(-30L);
            assertThat(expire.getOriginTransactionId()).isEqualTo(11L);
            assertThat(expire.getTransactionKey()).isEqualTo("EXPIRE:11");
        }

        @Test
        @DisplayName("실패 : 적용 후 잔액 음수")
        void redeem_negativeBalanceAfter_throws() {
            assertThatThrownBy(() -> PointsTransaction.redeem(MEMBER_ID, 40, -1, null, "r1", BASE_TIME))
                    .isInstanceOf(InvalidLedgerEntryException.class);
        }
    }

    @Nested
    @DisplayName("adminAdjust 팩토리")
    class AdminAdjustTest {

        @Test
        @DisplayName("성공 : 양수는 ADMIN_AWARD, 음수는 ADMIN_DEDUCT")
        void adminAdjust_kindBySign() {
            // when
            PointsTransaction award = PointsTransaction.adminAdjust(
                    MEMBER_ID, 50, 50, "admin", "보상", "cap", "a1", BASE_TIME);
            PointsTransaction deduct = PointsTransaction.adminAdjust(
                    MEMBER_ID, -20, 30, "admin", "회수", "cap", "a2", BASE_TIME);

            // then
            assertThat(award.getKind()).isEqualTo(TransactionKind.ADMIN_AWARD);
            assertThat(award.getNote()).isEqualTo("보상");
            assertThat(award.getAdminCapability()).isEqualTo("cap");
            assertThat(deduct.getKind()).isEqualTo(TransactionKind.ADMIN_DEDUCT);
            assertThat(deduct.getAmount()).isEqualTo(-20L);
        }

        @Test
        @DisplayName("실패 : 0 조정")
        void adminAdjust_zero_throws() {
            assertThatThrownBy(() -> PointsTransaction.adminAdjust(
                    MEMBER_ID, 0, 0, "admin", "사유", "cap", "a1", BASE_TIME))
                    .isInstanceOf(InvalidPointAmountException.class);
        }

        @Test
        @DisplayName("실패 : 사유 누락")
        void adminAdjust_blankReason_throws() {
            assertThatThrownBy(() -> PointsTransaction.adminAdjust(
                    MEMBER_ID, 10, 10, "admin", " ", "cap", "a1", BASE_TIME))
                    .isInstanceOf(InvalidLedgerEntryException.class);
        }
    }
}
