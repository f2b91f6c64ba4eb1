package com.iot.common.dto.diagnosis;

import com.fasterxml.jackson.annotation.JsonValue;
import com.iot.common.model.HealthVerdict;
import com.iot.common.model.prediction.ModelOutput;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One consensus value per model across a batch, plus the batch health verdict.
 *
 * Example JSON:
 * {
 *   "temperature": 41.7,
 *   "vibration": "Normal",
 *   "magnetic_flux": "Insufficient Data",
 *   "overall_health": "Healthy"
 * }
 */
public final class ConsensusMap {

    public static final String OVERALL_HEALTH = "overall_health";

    private final Map<String, ModelOutput> outputs;
    private final HealthVerdict overallHealth;

    public ConsensusMap(Map<String, ModelOutput> outputs, HealthVerdict overallHealth) {
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.overallHealth = overallHealth;
    }

    public static ConsensusMap of(Map<String, ModelOutput> outputs) {
        return new ConsensusMap(outputs, null);
    }

    /**
     * Returns a copy carrying the given batch verdict.
     */
    public ConsensusMap withOverallHealth(HealthVerdict verdict) {
        return new ConsensusMap(outputs, verdict);
    }

    public ModelOutput get(String modelName) {
        return outputs.get(modelName);
    }

    public Map<String, ModelOutput> outputs() {
        return outputs;
    }

    /**
     * Batch verdict, or null before reconciliation.
     */
    public HealthVerdict overallHealth() {
        return overallHealth;
    }

    @JsonValue
    public Map<String, Object> toJsonValue() {
        Map<String, Object> json = new LinkedHashMap<>(outputs);
        if (overallHealth != null) {
            json.put(OVERALL_HEALTH, overallHealth);
        }
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConsensusMap that = (ConsensusMap) o;
        return outputs.equals(that.outputs) && overallHealth == that.overallHealth;
    }

    @Override
    public int hashCode() {
        return 31 * outputs.hashCode() + (overallHealth != null ? overallHealth.hashCode() : 0);
    }

    @Override
    public String toString() {
        return "ConsensusMap" + toJsonValue();
    }
}
