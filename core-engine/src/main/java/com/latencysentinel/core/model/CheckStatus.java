package com.latencysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a single health check as reported by the check scheduler.
 *
 * @since 1.0.0
 */
public enum CheckStatus {
    UP,
    DOWN,
    DEGRADED;

    @JsonValue
    public String getWireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CheckStatus fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Check status must not be null or blank");
        }
        return CheckStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
