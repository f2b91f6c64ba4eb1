package com.iot.diagnostics.config;

import com.iot.common.model.SensorField;
import com.iot.diagnostics.config.DiagnosticsProperties.ModelSpec;
import com.iot.diagnostics.model.LinearRegressionModel;
import com.iot.diagnostics.model.ModelDescriptor;
import com.iot.diagnostics.model.PredictiveModel;
import com.iot.diagnostics.model.ThresholdClassifierModel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns configured model specs into descriptors.
 * Any inconsistency is reported as {@link IllegalStateException} so the
 * application refuses to start with a broken model set.
 */
final class ModelFactory {

    private ModelFactory() {} // Prevent instantiation

    static ModelDescriptor create(ModelSpec spec) {
        for (String feature : spec.features()) {
            // Rejects typos in feature names at startup
            try {
                SensorField.fromKey(feature);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Model " + spec.name() + ": " + e.getMessage(), e);
            }
        }

        PredictiveModel model = switch (spec.type()) {
            case LINEAR -> linear(spec);
            case THRESHOLD -> threshold(spec);
        };
        return ModelDescriptor.of(spec.name(), spec.features(), model);
    }

    private static PredictiveModel linear(ModelSpec spec) {
        List<Double> coefficients = spec.coefficients();
        if (coefficients == null || coefficients.size() != spec.features().size()) {
            throw new IllegalStateException(String.format(
                    "Model %s: expected %d coefficients, got %d",
                    spec.name(),
                    spec.features().size(),
                    coefficients == null ? 0 : coefficients.size()));
        }

        Map<String, Double> byFeature = new LinkedHashMap<>();
        for (int i = 0; i < coefficients.size(); i++) {
            byFeature.put(spec.features().get(i), coefficients.get(i));
        }
        double intercept = spec.intercept() != null ? spec.intercept() : 0.0;
        return new LinearRegressionModel(intercept, byFeature);
    }

    private static PredictiveModel threshold(ModelSpec spec) {
        if (spec.bands() == null || spec.bands().isEmpty()) {
            throw new IllegalStateException("Model " + spec.name() + ": threshold model requires bands");
        }
        if (spec.defaultLabel() == null || spec.defaultLabel().isBlank()) {
            throw new IllegalStateException("Model " + spec.name() + ": threshold model requires default-label");
        }

        List<ThresholdClassifierModel.Band> bands = spec.bands().stream()
                .map(band -> new ThresholdClassifierModel.Band(band.below(), band.label()))
                .toList();
        try {
            return new ThresholdClassifierModel(bands, spec.defaultLabel());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Model " + spec.name() + ": " + e.getMessage(), e);
        }
    }
}
