package com.iot.common.model.prediction;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The model itself failed on a record.
 */
public record PredictionError(String detail) implements ModelOutput {

    public static final String PREFIX = "Prediction Error: ";

    @JsonValue
    @Override
    public Object toJsonValue() {
        return PREFIX + detail;
    }
}
