package com.iot.common.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One raw record of a diagnostics batch.
 *
 * Values are kept exactly as received: a field may be absent, null,
 * a string, a number, or anything else the client sent. Validation
 * happens where the values are consumed.
 *
 * Example JSON:
 * {
 *   "temperature_one": 71.2,
 *   "temperature_two": "70.4",
 *   "vibration_x": 0.9,
 *   "vibration_y": null
 * }
 */
public final class SensorReading {

    private final Map<String, Object> values;

    @JsonCreator
    public SensorReading(Map<String, Object> values) {
        // LinkedHashMap tolerates null values, unlike Map.copyOf
        this.values = values != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(values))
                : Map.of();
    }

    /**
     * Returns the raw value for a field, or null when the field is absent.
     */
    public Object get(String key) {
        return values.get(key);
    }

    public Object get(SensorField field) {
        return get(field.getKey());
    }

    /**
     * Raw values for the given fields, in the given order. Absent fields map to null.
     */
    public List<Object> valuesOf(List<SensorField> fields) {
        return fields.stream()
                .map(this::get)
                .toList();
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    @JsonAnyGetter
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Factory method for convenience.
     */
    public static SensorReading of(Map<String, Object> values) {
        return new SensorReading(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((SensorReading) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "SensorReading" + values;
    }
}
