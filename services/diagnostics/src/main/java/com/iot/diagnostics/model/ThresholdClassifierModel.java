package com.iot.diagnostics.model;

import java.util.List;
import java.util.Map;

/**
 * Classifies the mean of the input features into ordered labelled bands.
 *
 * Bands are half-open: a score belongs to the first band whose upper bound
 * it is strictly below. Scores at or above the last bound get the default label.
 */
public final class ThresholdClassifierModel implements PredictiveModel {

    private final List<Band> bands;
    private final String defaultLabel;

    public ThresholdClassifierModel(List<Band> bands, String defaultLabel) {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("At least one band is required");
        }
        for (int i = 1; i < bands.size(); i++) {
            if (bands.get(i).below() <= bands.get(i - 1).below()) {
                throw new IllegalArgumentException("Band bounds must be strictly increasing");
            }
        }
        this.bands = List.copyOf(bands);
        this.defaultLabel = defaultLabel;
    }

    @Override
    public Object predict(Map<String, Double> features) {
        if (features.isEmpty()) {
            throw new IllegalArgumentException("No features supplied");
        }
        double score = features.values().stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElseThrow();

        for (Band band : bands) {
            if (score < band.below()) {
                return band.label();
            }
        }
        return defaultLabel;
    }

    /**
     * Scores strictly below {@code below} get {@code label}.
     */
    public record Band(double below, String label) {}
}
