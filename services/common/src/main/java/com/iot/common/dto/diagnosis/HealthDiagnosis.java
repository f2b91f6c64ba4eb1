package com.iot.common.dto.diagnosis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.iot.common.model.HealthVerdict;
import com.iot.common.model.MachineCondition;

import java.time.Instant;

/**
 * Rule-based health diagnosis of a single record.
 *
 * Example JSON:
 * {
 *   "machine_condition": "Maintain Condition",
 *   "temperature_analysis": "Moderate temperature anomaly: elevated operating temperature",
 *   "vibration_analysis": "No vibration anomaly detected",
 *   "data_completeness": {"temperature": "Complete", "vibration": "Complete"},
 *   "timestamp": "2024-01-15T10:30:00Z",
 *   "overall_health": "Unhealthy"
 * }
 */
@JsonPropertyOrder({
    "machine_condition",
    "temperature_analysis",
    "vibration_analysis",
    "data_completeness",
    "timestamp",
    "overall_health"
})
public record HealthDiagnosis(
    @JsonProperty("machine_condition")
    MachineCondition machineCondition,

    @JsonProperty("temperature_analysis")
    String temperatureAnalysis,

    @JsonProperty("vibration_analysis")
    String vibrationAnalysis,

    @JsonProperty("data_completeness")
    DataCompleteness dataCompleteness,

    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("overall_health")
    HealthVerdict overallHealth
) {
    public boolean hasInsufficientData() {
        return machineCondition.isInsufficientData();
    }
}
