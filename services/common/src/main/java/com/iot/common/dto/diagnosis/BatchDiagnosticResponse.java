package com.iot.common.dto.diagnosis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Reconciled result of one diagnostics batch.
 */
@JsonPropertyOrder({"predictions", "complete_health_analysis", "data_quality"})
public record BatchDiagnosticResponse(
    @JsonProperty("predictions")
    ConsensusMap predictions,

    @JsonProperty("complete_health_analysis")
    HealthAnalysis completeHealthAnalysis,

    @JsonProperty("data_quality")
    DataQuality dataQuality
) {}
