package com.iot.common.rules;

/**
 * Literal anomaly descriptions returned to clients.
 * Downstream consumers match on these strings, so they must not change.
 */
public final class AnomalyMessages {

    private AnomalyMessages() {} // Prevent instantiation

    public static final String TEMPERATURE_MISSING = "Temperature data missing or invalid";
    public static final String TEMPERATURE_NORMAL = "No temperature anomaly detected";
    public static final String TEMPERATURE_MODERATE = "Moderate temperature anomaly: elevated operating temperature";
    public static final String TEMPERATURE_SIGNIFICANT = "Significant temperature anomaly: overheating risk";
    public static final String TEMPERATURE_CRITICAL = "Critical temperature anomaly: immediate shutdown recommended";

    public static final String VIBRATION_MISSING = "Vibration data missing or invalid";
    public static final String VIBRATION_NORMAL = "No vibration anomaly detected";
    public static final String VIBRATION_UNBALANCE = "Unbalance fault suspected";
    public static final String VIBRATION_MISALIGNMENT = "Misalignment fault suspected";
    public static final String VIBRATION_LOOSENESS = "Looseness fault suspected";
    public static final String VIBRATION_BEARING = "Bearing or gear mesh fault suspected";
}
