package com.botprobe.verify.config;

/**
 * Invalid probe configuration. Raised eagerly, before any attempt runs.
 */
public class ProbeConfigException extends IllegalArgumentException {

    public ProbeConfigException(String message) {
        super(message);
    }

    public ProbeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
