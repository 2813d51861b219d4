package com.ureca.loyalty.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

// 테스트에서 시간을 앞으로 돌리기 위한 Clock
public class MutableClock extends Clock {

    private final ZoneId zone;
    private volatile Instant instant;

    public MutableClock(Instant instant, ZoneId zone) {
        this.instant = instant;
        this.zone = zone;
    }

    public static MutableClock systemDefault() {
        return new MutableClock(Instant.now(), ZoneId.systemDefault());
    }

    public void advance(Duration duration) {
        this.instant = instant.plus(duration);
    }

    public void reset() {
        this.instant = Instant.now();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
