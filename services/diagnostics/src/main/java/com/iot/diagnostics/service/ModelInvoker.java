package com.iot.diagnostics.service;

import com.iot.common.model.SensorReading;
import com.iot.common.model.prediction.ModelOutput;
import com.iot.common.util.SensorValues;
import com.iot.diagnostics.model.ModelDescriptor;
import com.iot.diagnostics.model.ModelRegistry;
import com.iot.diagnostics.model.RecordPredictions;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Runs models against single records.
 *
 * Never throws for bad input or a failing model: a missing or invalid
 * feature yields {@code Insufficient Data} without calling the model, and a
 * model failure yields {@code Prediction Error: <detail>}. One bad record
 * never aborts a batch.
 */
@Service
public class ModelInvoker {

    private static final Logger log = LoggerFactory.getLogger(ModelInvoker.class);

    static final String METRIC_INVOCATIONS = "diagnostics.model.invocations";

    private final ModelRegistry modelRegistry;
    private final MeterRegistry meterRegistry;

    public ModelInvoker(ModelRegistry modelRegistry, MeterRegistry meterRegistry) {
        this.modelRegistry = modelRegistry;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Runs every registered model against one record.
     */
    public RecordPredictions invokeAll(SensorReading reading) {
        Map<String, ModelOutput> outputs = new LinkedHashMap<>();
        for (ModelDescriptor descriptor : modelRegistry) {
            outputs.put(descriptor.name(), invoke(reading, descriptor));
        }
        return RecordPredictions.of(outputs);
    }

    /**
     * Runs one model against one record.
     */
    public ModelOutput invoke(SensorReading reading, ModelDescriptor descriptor) {
        Map<String, Double> features = new LinkedHashMap<>();
        for (String feature : descriptor.features()) {
            OptionalDouble value = SensorValues.toDouble(reading.get(feature));
            if (value.isEmpty()) {
                record(descriptor, "insufficient_data");
                return ModelOutput.insufficientData();
            }
            features.put(feature, value.getAsDouble());
        }

        Object prediction;
        try {
            prediction = descriptor.model().predict(features);
        } catch (Exception e) {
            record(descriptor, "error");
            log.warn("Model {} failed on features {}: {}", descriptor.name(), features, e.toString());
            return ModelOutput.error(describe(e));
        }

        if (prediction == null) {
            record(descriptor, "error");
            log.warn("Model {} returned no value for features {}", descriptor.name(), features);
            return ModelOutput.error("model returned no value");
        }

        record(descriptor, "success");
        if (prediction instanceof Number number) {
            return ModelOutput.numeric(number.doubleValue());
        }
        return ModelOutput.label(String.valueOf(prediction));
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void record(ModelDescriptor descriptor, String outcome) {
        meterRegistry.counter(METRIC_INVOCATIONS, "model", descriptor.name(), "outcome", outcome).increment();
    }
}
