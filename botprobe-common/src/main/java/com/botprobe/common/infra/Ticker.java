package com.botprobe.common.infra;

/**
 * Source of time and blocking waits for polling loops.
 * <p>
 * Production code uses {@link #SYSTEM}; tests substitute a virtual clock so
 * long poll intervals and retry delays complete instantly.
 */
public interface Ticker {

    /** Wall-clock ticker backed by {@link System#currentTimeMillis()} and {@link Thread#sleep(long)}. */
    Ticker SYSTEM = new Ticker() {
        @Override
        public long nowMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public void sleep(long ms) throws InterruptedException {
            Backoff.sleep(ms);
        }
    };

    /**
     * Current time in epoch milliseconds.
     */
    long nowMillis();

    /**
     * Block the calling thread for the given duration.
     *
     * @param ms milliseconds to wait; if {@code <= 0} returns immediately
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(long ms) throws InterruptedException;
}
