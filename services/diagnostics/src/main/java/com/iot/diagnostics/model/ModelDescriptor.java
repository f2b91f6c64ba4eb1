package com.iot.diagnostics.model;

import java.util.List;
import java.util.Objects;

/**
 * A named model together with the ordered sensor fields it requires.
 */
public record ModelDescriptor(
    String name,
    List<String> features,
    PredictiveModel model
) {
    public ModelDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(model, "model");
        if (features == null || features.isEmpty()) {
            throw new IllegalArgumentException("Model " + name + " must declare at least one feature");
        }
        features = List.copyOf(features);
    }

    public static ModelDescriptor of(String name, List<String> features, PredictiveModel model) {
        return new ModelDescriptor(name, features, model);
    }
}
