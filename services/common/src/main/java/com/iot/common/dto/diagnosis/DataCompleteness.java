package com.iot.common.dto.diagnosis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.iot.common.model.Completeness;

/**
 * Whether each averaged signal of a record resolved to a number.
 */
public record DataCompleteness(
    @JsonProperty("temperature")
    Completeness temperature,

    @JsonProperty("vibration")
    Completeness vibration
) {
    public boolean isComplete() {
        return temperature == Completeness.COMPLETE && vibration == Completeness.COMPLETE;
    }

    public static DataCompleteness of(boolean temperaturePresent, boolean vibrationPresent) {
        return new DataCompleteness(Completeness.of(temperaturePresent), Completeness.of(vibrationPresent));
    }
}
