package com.iot.common.model.prediction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A categorical prediction.
 */
public record LabelOutput(String label) implements ModelOutput {

    public LabelOutput {
        Objects.requireNonNull(label, "label");
    }

    @JsonValue
    @Override
    public Object toJsonValue() {
        return label;
    }
}
