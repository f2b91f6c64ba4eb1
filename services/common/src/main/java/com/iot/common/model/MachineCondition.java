package com.iot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine condition derived from averaged temperature and vibration.
 */
public enum MachineCondition {
    SAFE("Safe Condition"),
    MAINTAIN("Maintain Condition"),
    REPAIR("Repair Condition"),
    UNKNOWN("Unknown Condition - Insufficient Data");

    private final String label;

    MachineCondition(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isInsufficientData() {
        return this == UNKNOWN;
    }

    @JsonCreator
    public static MachineCondition fromLabel(String label) {
        for (MachineCondition condition : MachineCondition.values()) {
            if (condition.label.equals(label)) {
                return condition;
            }
        }
        throw new IllegalArgumentException("Unknown machine condition: " + label);
    }
}
