package com.iot.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Sensor fields carried by a machine reading, keyed by their wire name.
 */
public enum SensorField {
    // Temperature probes
    TEMPERATURE_ONE("temperature_one"),
    TEMPERATURE_TWO("temperature_two"),

    // 3-axis vibration
    VIBRATION_X("vibration_x"),
    VIBRATION_Y("vibration_y"),
    VIBRATION_Z("vibration_z"),

    // 3-axis magnetic flux
    MAGNETIC_FLUX_X("magnetic_flux_x"),
    MAGNETIC_FLUX_Y("magnetic_flux_y"),
    MAGNETIC_FLUX_Z("magnetic_flux_z"),

    // Acoustic
    AUDIBLE_SOUND("audible_sound"),
    ULTRA_SOUND("ultra_sound");

    public static final List<SensorField> TEMPERATURE = List.of(TEMPERATURE_ONE, TEMPERATURE_TWO);
    public static final List<SensorField> VIBRATION = List.of(VIBRATION_X, VIBRATION_Y, VIBRATION_Z);

    private final String key;

    SensorField(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static SensorField fromKey(String key) {
        for (SensorField field : SensorField.values()) {
            if (field.key.equals(key)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown sensor field: " + key);
    }
}
