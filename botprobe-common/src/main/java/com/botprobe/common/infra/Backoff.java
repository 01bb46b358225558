package com.botprobe.common.infra;

import java.time.Duration;

/**
 * Delay computation between retry attempts.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Backoff policy.
     *
     * @param initialMs delay before the second attempt, in milliseconds
     * @param maxMs     upper bound on any delay; {@code <= 0} means no cap
     * @param factor    multiplicative factor per attempt; {@code 1.0} keeps the
     *                  delay fixed
     */
    public record Policy(long initialMs, long maxMs, double factor) {

        public Policy {
            if (initialMs < 0) {
                throw new IllegalArgumentException("initialMs must be >= 0");
            }
            if (factor < 1.0) {
                throw new IllegalArgumentException("factor must be >= 1.0");
            }
        }

        /** Same delay between every pair of attempts. */
        public static Policy fixed(Duration delay) {
            return new Policy(delay.toMillis(), 0, 1.0);
        }
    }

    /**
     * Compute the delay that follows a failed attempt.
     *
     * @param policy  backoff policy
     * @param attempt 1-based number of the attempt that just failed
     * @return delay in milliseconds (capped at {@code policy.maxMs} when set)
     */
    public static long compute(Policy policy, int attempt) {
        double base = policy.initialMs() * Math.pow(policy.factor(), Math.max(attempt - 1, 0));
        long delay = base >= Long.MAX_VALUE ? Long.MAX_VALUE : Math.round(base);
        return policy.maxMs() > 0 ? Math.min(policy.maxMs(), delay) : delay;
    }

    /**
     * Sleep for the specified duration, respecting an interrupt.
     *
     * @param ms milliseconds to sleep; if {@code <= 0} returns immediately
     * @throws InterruptedException if the thread is interrupted during sleep
     */
    public static void sleep(long ms) throws InterruptedException {
        if (ms <= 0) {
            return;
        }
        Thread.sleep(ms);
    }
}
