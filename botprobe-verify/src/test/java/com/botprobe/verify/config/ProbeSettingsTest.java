package com.botprobe.verify.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProbeSettingsTest {

    private ProbeSettings.Builder valid() {
        return ProbeSettings.builder("bot", "owner/repo#1");
    }

    @Test
    void defaults() {
        ProbeSettings settings = valid().build();
        assertEquals(Duration.ofSeconds(120), settings.maxWait());
        assertEquals(Duration.ofSeconds(5), settings.pollInterval());
        assertEquals(3, settings.maxRetries());
        assertEquals(Duration.ofSeconds(60), settings.retryDelay());
        assertTrue(settings.autoDeleteOnFailure());
        assertEquals(1.0, settings.retryBackoffFactor());
        assertNull(settings.maxRetryDelay());
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -1 })
    void maxRetriesBelowOne_rejected(int maxRetries) {
        assertThrows(ProbeConfigException.class, () -> valid().maxRetries(maxRetries).build());
    }

    @Test
    void pollIntervalAboveMaxWait_rejected() {
        var err = assertThrows(ProbeConfigException.class, () -> valid()
                .maxWait(Duration.ofSeconds(10))
                .pollInterval(Duration.ofSeconds(11))
                .build());
        assertTrue(err.getMessage().contains("pollInterval"));
    }

    @Test
    void pollIntervalEqualToMaxWait_allowed() {
        assertDoesNotThrow(() -> valid().maxWait(Duration.ofSeconds(1)).pollInterval(Duration.ofSeconds(1)).build());
    }

    @Test
    void nonPositiveDurations_rejected() {
        assertThrows(ProbeConfigException.class, () -> valid().maxWait(Duration.ZERO).build());
        assertThrows(ProbeConfigException.class, () -> valid().pollInterval(Duration.ofSeconds(-1)).build());
        assertThrows(ProbeConfigException.class, () -> valid().retryDelay(Duration.ofMillis(-1)).build());
    }

    @Test
    void zeroRetryDelay_allowed() {
        assertEquals(Duration.ZERO, valid().retryDelay(Duration.ZERO).build().retryDelay());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "   " })
    void blankIdentities_rejected(String identity) {
        assertThrows(ProbeConfigException.class, () -> ProbeSettings.builder(identity, "c").build());
        assertThrows(ProbeConfigException.class, () -> ProbeSettings.builder("bot", identity).build());
    }

    @Test
    void backoffSettings_validated() {
        assertThrows(ProbeConfigException.class, () -> valid().retryBackoffFactor(0.5).build());
        assertThrows(ProbeConfigException.class, () -> valid().maxRetryDelay(Duration.ofSeconds(30)).build());
    }

    @Test
    void configFault_isIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> valid().maxRetries(0).build());
    }

    @Test
    void retryPolicy_reflectsSettings() {
        var policy = valid().retryDelay(Duration.ofSeconds(2)).retryBackoffFactor(3.0)
                .maxRetryDelay(Duration.ofSeconds(10)).build().retryPolicy();
        assertEquals(2_000, policy.initialMs());
        assertEquals(10_000, policy.maxMs());
        assertEquals(3.0, policy.factor());
    }

    @Test
    void toBuilder_roundTripsAndOverrides() {
        ProbeSettings original = valid().maxRetries(5).autoDeleteOnFailure(false).build();
        ProbeSettings copy = original.toBuilder().build();
        assertEquals(original, copy);
        assertEquals(1, original.toBuilder().maxRetries(1).build().maxRetries());
    }
}
