package com.iot.diagnostics.service;

import com.iot.common.dto.diagnosis.BatchDiagnosticResponse;
import com.iot.common.dto.diagnosis.ConsensusMap;
import com.iot.common.dto.diagnosis.HealthDiagnosis;
import com.iot.common.model.SensorReading;
import com.iot.diagnostics.exception.InvalidBatchException;
import com.iot.diagnostics.exception.MalformedPayloadException;
import com.iot.diagnostics.model.RecordPredictions;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a batch through the whole pipeline: model invocation, consensus,
 * rule diagnosis and reconciliation. Synchronous; one call handles one batch.
 */
@Service
public class DiagnosticService {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticService.class);

    private final BatchReader batchReader;
    private final ModelInvoker modelInvoker;
    private final PredictionAggregator aggregator;
    private final HealthAnalyzer healthAnalyzer;
    private final ResultReconciler reconciler;

    // Metrics
    private final Counter batchesProcessed;
    private final Counter batchesRejected;
    private final Counter recordsProcessed;
    private final Timer batchLatency;

    public DiagnosticService(
            BatchReader batchReader,
            ModelInvoker modelInvoker,
            PredictionAggregator aggregator,
            HealthAnalyzer healthAnalyzer,
            ResultReconciler reconciler,
            MeterRegistry meterRegistry) {
        this.batchReader = batchReader;
        this.modelInvoker = modelInvoker;
        this.aggregator = aggregator;
        this.healthAnalyzer = healthAnalyzer;
        this.reconciler = reconciler;

        this.batchesProcessed = Counter.builder("diagnostics.batches.processed")
                .description("Number of batches diagnosed")
                .register(meterRegistry);

        this.batchesRejected = Counter.builder("diagnostics.batches.rejected")
                .description("Number of payloads rejected before diagnosis")
                .register(meterRegistry);

        this.recordsProcessed = Counter.builder("diagnostics.records.processed")
                .description("Number of records diagnosed")
                .register(meterRegistry);

        this.batchLatency = Timer.builder("diagnostics.batch.latency")
                .description("Time taken to diagnose one batch")
                .register(meterRegistry);
    }

    /**
     * Parses, validates and diagnoses a raw JSON payload.
     *
     * @throws MalformedPayloadException if the payload is not JSON
     * @throws InvalidBatchException if it is not an array of 1 to max-batch-size objects
     */
    public BatchDiagnosticResponse diagnose(String payload) {
        List<SensorReading> readings;
        try {
            readings = batchReader.read(payload);
        } catch (InvalidBatchException | MalformedPayloadException e) {
            batchesRejected.increment();
            log.warn("Rejected diagnostics payload: {}", e.getMessage());
            throw e;
        }
        return diagnose(readings);
    }

    /**
     * Diagnoses already-parsed readings.
     */
    public BatchDiagnosticResponse diagnose(List<SensorReading> readings) {
        return batchLatency.record(() -> run(readings));
    }

    private BatchDiagnosticResponse run(List<SensorReading> readings) {
        log.debug("Diagnosing batch: records={}", readings.size());

        List<RecordPredictions> predictions = new ArrayList<>(readings.size());
        List<HealthDiagnosis> diagnoses = new ArrayList<>(readings.size());
        for (SensorReading reading : readings) {
            predictions.add(modelInvoker.invokeAll(reading));
            diagnoses.add(healthAnalyzer.analyze(reading));
        }

        ConsensusMap consensus = aggregator.aggregate(predictions);
        BatchDiagnosticResponse response = reconciler.reconcile(consensus, diagnoses, readings.size(), predictions);

        batchesProcessed.increment();
        recordsProcessed.increment(readings.size());
        log.info("Diagnosed batch: records={}, complete={}, overallHealth={}",
                readings.size(),
                response.dataQuality().completeRecords(),
                response.predictions().overallHealth().getLabel());

        return response;
    }
}
