package com.ryuqq.registry.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Test clock whose current instant is set explicitly.
 *
 * <p>Thread-safe: the instant is held in a volatile field.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private volatile Instant instant;
    private final ZoneId zone;

    public MutableClock(Instant instant) {
        this(instant, ZoneOffset.UTC);
    }

    private MutableClock(Instant instant, ZoneId zone) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        this.instant = instant;
        this.zone = zone;
    }

    /**
     * Clock starting at the given epoch millis.
     *
     * @param epochMillis start time
     * @return MutableClock
     */
    public static MutableClock atMillis(long epochMillis) {
        return new MutableClock(Instant.ofEpochMilli(epochMillis));
    }

    public void advance(Duration duration) {
        this.instant = instant.plus(duration);
    }

    public void setMillis(long epochMillis) {
        this.instant = Instant.ofEpochMilli(epochMillis);
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
