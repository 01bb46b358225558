package com.botprobe.common.infra;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorUtilsTest {

    @Test
    void formatErrorMessage_usesMessage() {
        assertEquals("boom", ErrorUtils.formatErrorMessage(new IllegalStateException("boom")));
    }

    @Test
    void formatErrorMessage_fallsBackToClassName() {
        assertEquals("NullPointerException", ErrorUtils.formatErrorMessage(new NullPointerException()));
    }

    @Test
    void formatErrorMessage_null() {
        assertEquals("Error", ErrorUtils.formatErrorMessage(null));
    }

    @Test
    void formatErrorChain_walksCauses() {
        var err = new RuntimeException("list failed", new IOException("connection reset"));
        assertEquals("list failed -> connection reset", ErrorUtils.formatErrorChain(err));
    }

    @Test
    void formatErrorChain_null() {
        assertEquals("unknown error", ErrorUtils.formatErrorChain(null));
    }
}
