package com.iot.diagnostics.model;

import java.util.Map;

/**
 * A trained model treated as a black box.
 *
 * Implementations receive one record's features keyed by name, in the order
 * the model declared them, and return either a {@link Number} or a label.
 * They must be reentrant: one instance serves every batch.
 */
@FunctionalInterface
public interface PredictiveModel {

    Object predict(Map<String, Double> features);
}
