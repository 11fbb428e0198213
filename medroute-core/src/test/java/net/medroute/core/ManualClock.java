package net.medroute.core;

import net.medroute.core.spi.Clock;
import net.medroute.core.spi.Sleeper;

import java.time.Duration;
import java.time.Instant;

/** 테스트용 가짜 시간: sleep 하면 시계만 전진 */
public final class ManualClock implements Clock, Sleeper {
    private Instant now;

    public ManualClock() {
        this(Instant.parse("2025-01-01T00:00:00Z"));
    }

    public ManualClock(Instant start) {
        this.now = start;
    }

    @Override
    public synchronized Instant now() {
        return now;
    }

    public synchronized void advance(Duration d) {
        now = now.plus(d);
    }

    @Override
    public void sleep(Duration d) {
        if (!d.isNegative()) advance(d);
    }
}
