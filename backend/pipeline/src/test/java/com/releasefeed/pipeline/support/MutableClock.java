package com.releasefeed.pipeline.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * UTC test clock that can be moved, e.g. across midnight or a year boundary between two runs.
 */
public class MutableClock extends Clock {
    private final AtomicReference<Instant> now;

    public MutableClock(Instant initial) {
        this.now = new AtomicReference<>(initial);
    }

    public void setInstant(Instant next) {
        now.set(next);
    }

    public void advance(Duration step) {
        now.updateAndGet(current -> current.plus(step));
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return Clock.fixed(now.get(), zone);
    }

    @Override
    public Instant instant() {
        return now.get();
    }
}
