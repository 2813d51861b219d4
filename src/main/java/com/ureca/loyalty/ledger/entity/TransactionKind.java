package com.ureca.loyalty.ledger.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 포인트 원장 항목 종류
 * 부호 규칙: 적립성(EARN, ADMIN_AWARD)은 양수, 나머지는 음수
 */
@Getter
@RequiredArgsConstructor
public enum TransactionKind {
    EARN("적립"),
    REDEEM("사용"),
    EXPIRE("소멸"),
    ADMIN_AWARD("관리자 지급"),
    ADMIN_DEDUCT("관리자 차감");

    private final String displayName;

    // 적립성 항목은 포인트 묶음(lot)을 새로 연다
    public boolean isCredit() {
        return switch (this) {
            case EARN, ADMIN_AWARD -> true;
            case REDEEM, EXPIRE, ADMIN_DEDUCT -> false;
        };
    }

    public boolean isAdmin() {
        return switch (this) {
            case ADMIN_AWARD, ADMIN_DEDUCT -> true;
            case EARN, REDEEM, EXPIRE -> false;
        };
    }

    /**
     * 크기(양수)를 이 종류의 부호가 붙은 금액으로 변환
     *
     * @param magnitude 0보다 큰 포인트
     * @return 부호가 적용된 금액
     */
    public long signed(long magnitude) {
        return isCredit() ? magnitude : -magnitude;
    }

    public boolean isConsistentWith(long amount) {
        return isCredit() ? amount > 0 : amount < 0;
    }
}
