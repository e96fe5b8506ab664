package com.latencysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classification attached to an {@link AnomalyVerdict}.
 *
 * <p>
 * Serialized as the lowercase wire values {@code spike}, {@code slowdown}
 * and {@code unknown}, which is what the incident store persists.
 * </p>
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    /** Extreme, sudden latency increase. */
    SPIKE("spike"),

    /** Moderate latency increase that still crosses the detection bar. */
    SLOWDOWN("slowdown"),

    /** No anomaly, too little history, or a faster-than-usual response. */
    UNKNOWN("unknown");

    private final String wireValue;

    AnomalyType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Resolve a type from its wire value (case-insensitive).
     *
     * @param value wire value, e.g. {@code "spike"}
     * @return the matching type
     * @throws IllegalArgumentException if {@code value} is not a known type
     */
    @JsonCreator
    public static AnomalyType fromWireValue(String value) {
        if (value != null) {
            String normalised = value.toLowerCase(Locale.ROOT);
            for (AnomalyType type : values()) {
                if (type.wireValue.equals(normalised)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: '" + value
                + "'. Supported: spike, slowdown, unknown");
    }
}
