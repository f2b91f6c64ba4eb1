package com.iot.diagnostics.service;

import com.iot.common.model.SensorReading;
import com.iot.common.model.prediction.InsufficientData;
import com.iot.common.model.prediction.LabelOutput;
import com.iot.common.model.prediction.ModelOutput;
import com.iot.common.model.prediction.NumericOutput;
import com.iot.common.model.prediction.PredictionError;
import com.iot.diagnostics.TestModels;
import com.iot.diagnostics.model.ModelDescriptor;
import com.iot.diagnostics.model.ModelRegistry;
import com.iot.diagnostics.model.PredictiveModel;
import com.iot.diagnostics.model.RecordPredictions;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelInvokerTest {

    private TestModels models;
    private SimpleMeterRegistry meterRegistry;
    private ModelInvoker invoker;

    @BeforeEach
    void setup() {
        models = new TestModels();
        meterRegistry = new SimpleMeterRegistry();
        invoker = new ModelInvoker(models.registry(), meterRegistry);
    }

    private static ModelDescriptor descriptor(PredictiveModel model) {
        return ModelDescriptor.of("scorer", List.of("temperature_one", "temperature_two"), model);
    }

    @Test
    void passesFeaturesInDeclaredOrder() {
        List<String> seen = new ArrayList<>();
        Map<String, Object> values = TestModels.healthyValues();
        values.put("temperature_one", "69.5");

        ModelOutput output = invoker.invoke(SensorReading.of(values), descriptor(features -> {
            seen.addAll(features.keySet());
            return features.get("temperature_one");
        }));

        assertEquals(List.of("temperature_one", "temperature_two"), seen);
        assertEquals(new NumericOutput(69.5), output);
    }

    @Test
    void invalidFeatureShortCircuitsWithoutCallingModel() {
        Map<String, Object> values = TestModels.healthyValues();
        values.put("temperature_two", "broken");

        ModelOutput output = invoker.invoke(SensorReading.of(values), descriptor(features -> {
            fail("model must not be called");
            return null;
        }));

        assertInstanceOf(InsufficientData.class, output);
        assertEquals(1.0, meterRegistry.counter(ModelInvoker.METRIC_INVOCATIONS,
                "model", "scorer", "outcome", "insufficient_data").count());
    }

    @Test
    void missingFeatureIsInsufficientData() {
        Map<String, Object> values = TestModels.healthyValues();
        values.remove("temperature_one");

        assertInstanceOf(InsufficientData.class,
                invoker.invoke(SensorReading.of(values), descriptor(features -> 1.0)));
    }

    @Test
    void modelFailureBecomesPredictionError() {
        ModelOutput output = invoker.invoke(TestModels.healthyReading(), descriptor(features -> {
            throw new IllegalStateException("weights corrupted");
        }));

        assertEquals(new PredictionError("weights corrupted"), output);
        assertEquals("Prediction Error: weights corrupted", output.toJsonValue());
    }

    @Test
    void checkedFailureFromModelRuntimeBecomesPredictionError() {
        ModelOutput output = invoker.invoke(TestModels.healthyReading(), descriptor(features ->
                sneakyThrow(new IOException("model file unreadable"))));

        assertEquals(new PredictionError("model file unreadable"), output);
        assertEquals(1.0, meterRegistry.counter(ModelInvoker.METRIC_INVOCATIONS,
                "model", "scorer", "outcome", "error").count());
    }

    // Rethrows a checked exception undeclared, as native model runtimes can
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> Object sneakyThrow(Throwable t) throws E {
        throw (E) t;
    }

    @Test
    void nullPredictionBecomesPredictionError() {
        ModelOutput output = invoker.invoke(TestModels.healthyReading(), descriptor(features -> null));

        assertEquals(new PredictionError("model returned no value"), output);
    }

    @Test
    void normalizesNumbersAndLabels() {
        assertEquals(new NumericOutput(3.0), invoker.invoke(TestModels.healthyReading(), descriptor(features -> 3)));
        assertEquals(new LabelOutput("Normal"),
                invoker.invoke(TestModels.healthyReading(), descriptor(features -> "Normal")));
        assertEquals(new LabelOutput("true"),
                invoker.invoke(TestModels.healthyReading(), descriptor(features -> Boolean.TRUE)));
    }

    @Test
    void invokeAll_runsEveryRegisteredModelInOrder() {
        Map<String, Object> values = TestModels.healthyValues();
        values.remove("vibration_y");
        values.remove("vibration_z");

        RecordPredictions predictions = invoker.invokeAll(SensorReading.of(values));

        assertEquals(List.of("temperature", "vibration", "magnetic_flux", "audible_sound", "ultra_sound"),
                List.copyOf(predictions.outputs().keySet()));
        assertEquals(new NumericOutput(70.0), predictions.get("temperature"));
        assertInstanceOf(NumericOutput.class, predictions.get("magnetic_flux"));
        assertInstanceOf(InsufficientData.class, predictions.get("vibration"));
        assertInstanceOf(InsufficientData.class, predictions.get("audible_sound"));
        assertInstanceOf(InsufficientData.class, predictions.get("ultra_sound"));
        assertTrue(predictions.hasInsufficientData());
        assertEquals(2, models.calls());
    }

    @Test
    void failingModelDoesNotAffectOthers() {
        ModelRegistry registry = ModelRegistry.of(
                ModelDescriptor.of("broken", List.of("temperature_one"), features -> {
                    throw new ArithmeticException();
                }),
                ModelDescriptor.of("fine", List.of("temperature_one"), features -> "ok"));
        ModelInvoker invoker = new ModelInvoker(registry, meterRegistry);

        RecordPredictions predictions = invoker.invokeAll(TestModels.healthyReading());

        assertEquals(new PredictionError("ArithmeticException"), predictions.get("broken"));
        assertEquals(new LabelOutput("ok"), predictions.get("fine"));
        assertFalse(predictions.hasInsufficientData());
    }
}
