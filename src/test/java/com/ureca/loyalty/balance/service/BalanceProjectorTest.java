package com.ureca.loyalty.balance.service;

import com.ureca.loyalty.balance.entity.PointBalance;
import com.ureca.loyalty.balance.exception.NegativeBalanceException;
import com.ureca.loyalty.balance.exception.StaleVersionException;
import com.ureca.loyalty.ledger.exception.InvalidPointAmountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static com.ureca.loyalty.support.fixture.LedgerFixture.BASE_TIME;
import static com.ureca.loyalty.support.fixture.LedgerFixture.balance;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BalanceProjector 단위 테스트")
class BalanceProjectorTest {

    private final BalanceProjector projector = new BalanceProjector();

    @Test
    @DisplayName("성공 : 반영 후 잔액과 다음 버전을 계산하고 엔티티는 바꾸지 않음")
    void apply_computesSnapshot() {
        // given
        PointBalance balance = balance(1L, 100, "Bronze");
        LocalDateTime now = BASE_TIME.plusHours(1);

        // when
        BalanceSnapshot snapshot = projector.apply(balance, -40, 0L, now);

        // then
        assertThat(snapshot.balance()).isEqualTo(60L);
        assertThat(snapshot.version()).isEqualTo(1L);
        assertThat(snapshot.updatedAt()).isEqualTo(now);
        assertThat(balance.getCurrentBalance()).isEqualTo(100L);
    }

    @Test
    @DisplayName("성공 : 정확히 0까지는 허용")
    void apply_toZero() {
        // given
        PointBalance balance = balance(1L, 100, "Bronze");

        // when
        BalanceSnapshot snapshot = projector.apply(balance, -100, 0L, BASE_TIME);

        // then
        assertThat(snapshot.balance()).isZero();
    }

    @Test
    @DisplayName("실패 : 반영 후 음수")
    void apply_negative_throws() {
        // given
        PointBalance balance = balance(1L, 100, "Bronze");

        // when, then
        assertThatThrownBy(() -> projector.apply(balance, -101, 0L, BASE_TIME))
                .isInstanceOf(NegativeBalanceException.class)
                .satisfies(e -> {
                    NegativeBalanceException ex = (NegativeBalanceException) e;
                    assertThat(ex.getCurrentBalance()).isEqualTo(100L);
                    assertThat(ex.getDelta()).isEqualTo(-101L);
                });
    }

    @Test
    @DisplayName("실패 : 읽은 버전과 다르면 덮어쓰지 않음")
    void apply_staleVersion_throws() {
        // given
        PointBalance balance = balance(1L, 100, "Bronze");

        // when, then
        assertThatThrownBy(() -> projector.apply(balance, 10, 3L, BASE_TIME))
                .isInstanceOf(StaleVersionException.class);
    }

    @Test
    @DisplayName("실패 : 잔액 범위(long) 초과는 ArithmeticException 이 아닌 포인트 금액 오류")
    void apply_overflow_throwsInvalidAmount() {
        // given
        PointBalance balance = balance(1L, Long.MAX_VALUE, "Platinum");

        // when, then
        assertThatThrownBy(() -> projector.apply(balance, 1, 0L, BASE_TIME))
                .isInstanceOf(InvalidPointAmountException.class);
        assertThat(balance.getCurrentBalance()).isEqualTo(Long.MAX_VALUE);
    }
}
