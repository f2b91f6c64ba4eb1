package com.iot.common.model.prediction;

/**
 * Outcome of running one model against one record, or the consensus of
 * a model across a batch.
 *
 * Only {@link NumericOutput} and {@link LabelOutput} carry an actual
 * prediction; the other two are sentinels standing in for "could not compute".
 * Every variant serializes to a bare JSON scalar.
 */
public sealed interface ModelOutput permits NumericOutput, LabelOutput, InsufficientData, PredictionError {

    /**
     * Value written to JSON: a number for numeric predictions, a string otherwise.
     */
    Object toJsonValue();

    static ModelOutput numeric(double value) {
        return new NumericOutput(value);
    }

    static ModelOutput label(String label) {
        return new LabelOutput(label);
    }

    static ModelOutput insufficientData() {
        return InsufficientData.INSTANCE;
    }

    static ModelOutput error(String detail) {
        return new PredictionError(detail);
    }
}
