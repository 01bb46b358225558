package com.botprobe.common.infra;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Virtual-time {@link Ticker}: {@link #sleep(long)} advances the clock instead
 * of blocking. Intended for tests of polling and retry loops.
 */
public class ManualTicker implements Ticker {

    private final AtomicLong nowMs;
    private final AtomicLong totalSleptMs = new AtomicLong();
    private final AtomicInteger sleepCalls = new AtomicInteger();

    public ManualTicker(long startMs) {
        this.nowMs = new AtomicLong(startMs);
    }

    public ManualTicker() {
        this(1_700_000_000_000L);
    }

    @Override
    public long nowMillis() {
        return nowMs.get();
    }

    @Override
    public void sleep(long ms) throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("sleep interrupted");
        }
        sleepCalls.incrementAndGet();
        if (ms <= 0) {
            return;
        }
        totalSleptMs.addAndGet(ms);
        nowMs.addAndGet(ms);
    }

    public void advance(long ms) {
        nowMs.addAndGet(Math.max(0, ms));
    }

    public long getTotalSleptMs() {
        return totalSleptMs.get();
    }

    public int getSleepCalls() {
        return sleepCalls.get();
    }
}
