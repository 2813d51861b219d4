package com.ureca.loyalty.ledger.service;

import com.ureca.loyalty.ledger.entity.PointLot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static com.ureca.loyalty.support.fixture.LedgerFixture.BASE_TIME;
import static com.ureca.loyalty.support.fixture.LedgerFixture.lot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LotAllocator 단위 테스트")
class LotAllocatorTest {

    private static final Long MEMBER_ID = 1L;

    private final LotAllocator lotAllocator = new LotAllocator();

    @Test
    @DisplayName("성공 : 오래된 묶음부터 차감")
    void allocate_oldestFirst() {
        // given
        PointLot newer = lot(2L, MEMBER_ID, 100, BASE_TIME.plusDays(1), 30);
        PointLot older = lot(1L, MEMBER_ID, 100, BASE_TIME, 30);

        // when
        List<LotAllocation> allocations = lotAllocator.allocate(List.of(newer, older), 150, BASE_TIME.plusDays(2));

        // then
        assertThat(allocations).extracting(a -> a.lot().getId()).containsExactly(1L, 2L);
        assertThat(allocations).extracting(LotAllocation::amount).containsExactly(100L, 50L);
    }

    @Test
    @DisplayName("성공 : 만료 안 된 묶음을 먼저, 부족할 때만 만료된 묶음 사용")
    void allocate_unexpiredBeforeExpired() {
        // given
        PointLot expired = lot(1L, MEMBER_ID, 100, BASE_TIME, 1);
        PointLot active = lot(2L, MEMBER_ID, 100, BASE_TIME.plusDays(1), 30);
        LocalDateTime now = BASE_TIME.plusDays(5);

        // when
        List<LotAllocation> onlyActive = lotAllocator.allocate(List.of(expired, active), 80, now);
        List<LotAllocation> both = lotAllocator.allocate(List.of(expired, active), 130, now);

        // then
        assertThat(onlyActive).extracting(a -> a.lot().getId()).containsExactly(2L);
        assertThat(both).extracting(a -> a.lot().getId()).containsExactly(2L, 1L);
        assertThat(both).extracting(LotAllocation::amount).containsExactly(100L, 30L);
    }

    @Test
    @DisplayName("실패 : 묶음 잔여 합이 부족")
    void allocate_insufficient_throws() {
        // given
        PointLot only = lot(1L, MEMBER_ID, 50, BASE_TIME, 30);

        // when, then
        assertThatThrownBy(() -> lotAllocator.allocate(List.of(only), 51, BASE_TIME))
                .isInstanceOf(IllegalStateException.class);
    }
}
