package com.iot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health verdicts reported per record and per batch.
 * {@link #INSUFFICIENT_DATA} is only produced at batch level.
 */
public enum HealthVerdict {
    HEALTHY("Healthy"),
    UNHEALTHY("Unhealthy"),
    UNKNOWN("Unknown"),
    INSUFFICIENT_DATA("Unknown - Insufficient Data");

    private final String label;

    HealthVerdict(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Per-record verdict for a machine condition.
     */
    public static HealthVerdict of(MachineCondition condition) {
        return switch (condition) {
            case UNKNOWN -> UNKNOWN;
            case SAFE -> HEALTHY;
            case MAINTAIN, REPAIR -> UNHEALTHY;
        };
    }

    @JsonCreator
    public static HealthVerdict fromLabel(String label) {
        for (HealthVerdict verdict : HealthVerdict.values()) {
            if (verdict.label.equals(label)) {
                return verdict;
            }
        }
        throw new IllegalArgumentException("Unknown health verdict: " + label);
    }
}
