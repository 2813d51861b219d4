package com.ureca.loyalty.tier.exception;

import com.ureca.loyalty.common.exception.InternalServerException;

import static com.ureca.loyalty.common.BaseCode.INVALID_TIER_CONFIGURATION;

// 등급 설정 오류, 기동 시점에 실패시킨다
public class InvalidTierConfigurationException extends InternalServerException {

    public InvalidTierConfigurationException(String message) {
        super(INVALID_TIER_CONFIGURATION, message);
    }
}
