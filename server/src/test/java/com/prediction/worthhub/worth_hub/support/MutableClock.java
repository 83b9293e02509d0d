package com.prediction.worthhub.worth_hub.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Test clock that only moves when told to.
 */
public class MutableClock extends Clock {

    private volatile Instant instant;

    public MutableClock(long epochSecond) {
        this.instant = Instant.ofEpochSecond(epochSecond);
    }

    public void setEpochSecond(long epochSecond) {
        this.instant = Instant.ofEpochSecond(epochSecond);
    }

    public void advanceSeconds(long seconds) {
        this.instant = instant.plusSeconds(seconds);
    }

    public long epochSecond() {
        return instant.getEpochSecond();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
