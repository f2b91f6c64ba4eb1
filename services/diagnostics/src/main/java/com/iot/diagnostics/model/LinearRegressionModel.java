package com.iot.diagnostics.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Linear regression scorer: intercept plus one coefficient per feature.
 */
public final class LinearRegressionModel implements PredictiveModel {

    private final double intercept;
    private final Map<String, Double> coefficients;

    public LinearRegressionModel(double intercept, Map<String, Double> coefficients) {
        this.intercept = intercept;
        this.coefficients = Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
    }

    @Override
    public Object predict(Map<String, Double> features) {
        double score = intercept;
        for (Map.Entry<String, Double> term : coefficients.entrySet()) {
            Double value = features.get(term.getKey());
            if (value == null) {
                throw new IllegalArgumentException("Missing feature: " + term.getKey());
            }
            score += term.getValue() * value;
        }
        return score;
    }
}
