package com.iot.common.model.prediction;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A required feature was missing or invalid, so the model was not called.
 * Also the consensus for a model with no usable prediction in the batch.
 */
public record InsufficientData() implements ModelOutput {

    public static final String LABEL = "Insufficient Data";

    static final InsufficientData INSTANCE = new InsufficientData();

    @JsonValue
    @Override
    public Object toJsonValue() {
        return LABEL;
    }
}
