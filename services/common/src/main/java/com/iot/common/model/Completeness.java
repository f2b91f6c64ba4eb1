package com.iot.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether an averaged signal resolved to a real number.
 */
public enum Completeness {
    COMPLETE("Complete"),
    INCOMPLETE("Incomplete");

    private final String label;

    Completeness(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Completeness of(boolean present) {
        return present ? COMPLETE : INCOMPLETE;
    }
}
