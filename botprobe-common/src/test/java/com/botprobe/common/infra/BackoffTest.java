package com.botprobe.common.infra;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    @Test
    void fixedPolicy_sameDelayForEveryAttempt() {
        var policy = Backoff.Policy.fixed(Duration.ofSeconds(60));
        assertEquals(60_000, Backoff.compute(policy, 1));
        assertEquals(60_000, Backoff.compute(policy, 2));
        assertEquals(60_000, Backoff.compute(policy, 5));
    }

    @Test
    void exponentialPolicy_doublesAndCaps() {
        var policy = new Backoff.Policy(1_000, 5_000, 2.0);
        assertEquals(1_000, Backoff.compute(policy, 1));
        assertEquals(2_000, Backoff.compute(policy, 2));
        assertEquals(4_000, Backoff.compute(policy, 3));
        assertEquals(5_000, Backoff.compute(policy, 4)); // capped
    }

    @Test
    void zeroDelay_staysZero() {
        var policy = new Backoff.Policy(0, 0, 3.0);
        assertEquals(0, Backoff.compute(policy, 4));
    }

    @Test
    void factorBelowOne_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new Backoff.Policy(100, 0, 0.5));
    }

    @Test
    void negativeInitial_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new Backoff.Policy(-1, 0, 1.0));
    }

    @Test
    void sleep_nonPositiveReturnsImmediately() throws Exception {
        long start = System.nanoTime();
        Backoff.sleep(0);
        Backoff.sleep(-50);
        assertTrue(System.nanoTime() - start < 50_000_000L);
    }
}
