package com.ryuqq.prp.testkit.fake;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 테스트에서 직접 진행시키는 시계.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FakeClock extends Clock {

    private final ZoneId zone;
    private volatile Instant now;

    public FakeClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    public FakeClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        this.now = start;
        this.zone = zone;
    }

    public void advance(Duration duration) {
        now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new FakeClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now;
    }
}
