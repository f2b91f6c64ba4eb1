package com.iot.diagnostics.service;

import com.iot.common.dto.diagnosis.BatchDiagnosticResponse;
import com.iot.common.dto.diagnosis.ConsensusMap;
import com.iot.common.dto.diagnosis.DataQuality;
import com.iot.common.dto.diagnosis.HealthAnalysis;
import com.iot.common.dto.diagnosis.HealthDiagnosis;
import com.iot.common.model.HealthVerdict;
import com.iot.diagnostics.model.RecordPredictions;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Combines model consensus and rule diagnoses into the batch response.
 * Pure: the same inputs always give an equal response.
 */
@Service
public class ResultReconciler {

    public BatchDiagnosticResponse reconcile(
            ConsensusMap consensus,
            List<HealthDiagnosis> diagnoses,
            int batchSize,
            List<RecordPredictions> predictions) {

        ConsensusMap withHealth = consensus.withOverallHealth(batchVerdict(diagnoses));

        int complete = (int) predictions.stream()
                .filter(record -> !record.hasInsufficientData())
                .count();

        return new BatchDiagnosticResponse(
                withHealth,
                new HealthAnalysis(diagnoses),
                DataQuality.of(batchSize, complete)
        );
    }

    /**
     * Batch verdict from the per-record diagnoses only; model outputs play no part.
     * Unknown if no record had enough data, else Unhealthy if any record is, else Healthy.
     */
    public static HealthVerdict batchVerdict(List<HealthDiagnosis> diagnoses) {
        if (diagnoses.stream().allMatch(HealthDiagnosis::hasInsufficientData)) {
            return HealthVerdict.INSUFFICIENT_DATA;
        }
        if (diagnoses.stream().anyMatch(d -> d.overallHealth() == HealthVerdict.UNHEALTHY)) {
            return HealthVerdict.UNHEALTHY;
        }
        return HealthVerdict.HEALTHY;
    }
}
