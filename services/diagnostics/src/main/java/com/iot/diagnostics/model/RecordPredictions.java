package com.iot.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.iot.common.model.prediction.InsufficientData;
import com.iot.common.model.prediction.ModelOutput;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every model's output for one record, keyed by model name.
 */
public final class RecordPredictions {

    private final Map<String, ModelOutput> outputs;

    public RecordPredictions(Map<String, ModelOutput> outputs) {
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public static RecordPredictions of(Map<String, ModelOutput> outputs) {
        return new RecordPredictions(outputs);
    }

    /**
     * Output of the named model, or null if the model was not run for this record.
     */
    public ModelOutput get(String modelName) {
        return outputs.get(modelName);
    }

    /**
     * True if any model lacked usable input for this record.
     * Prediction errors do not make a record incomplete.
     */
    public boolean hasInsufficientData() {
        return outputs.values().stream().anyMatch(InsufficientData.class::isInstance);
    }

    @JsonValue
    public Map<String, ModelOutput> outputs() {
        return outputs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return outputs.equals(((RecordPredictions) o).outputs);
    }

    @Override
    public int hashCode() {
        return outputs.hashCode();
    }

    @Override
    public String toString() {
        return "RecordPredictions" + outputs;
    }
}
