package com.iot.common.dto.diagnosis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Per-record diagnoses of a batch.
 * A single-record batch serializes as the bare diagnosis object, larger
 * batches as an array.
 */
public record HealthAnalysis(List<HealthDiagnosis> diagnoses) {

    public HealthAnalysis {
        diagnoses = diagnoses != null ? List.copyOf(diagnoses) : List.of();
    }

    public int size() {
        return diagnoses.size();
    }

    @JsonValue
    public Object toJsonValue() {
        return diagnoses.size() == 1 ? diagnoses.get(0) : diagnoses;
    }
}
