package com.iot.common.model.prediction;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A numeric prediction, e.g. a regression score.
 */
public record NumericOutput(double value) implements ModelOutput {

    /**
     * NaN and infinite predictions never take part in a consensus mean.
     */
    public boolean isFinite() {
        return Double.isFinite(value);
    }

    @JsonValue
    @Override
    public Object toJsonValue() {
        return value;
    }
}
