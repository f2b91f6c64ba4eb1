package com.iot.common.rules;

import com.iot.common.model.MachineCondition;
import com.iot.common.rules.ConditionThresholds.Temperature;
import com.iot.common.rules.ConditionThresholds.Vibration;

import java.util.OptionalDouble;

/**
 * Threshold rules over averaged temperature and vibration.
 * An empty input means the average could not be computed.
 */
public final class ConditionRules {

    private ConditionRules() {} // Prevent instantiation

    public static MachineCondition machineCondition(OptionalDouble temperature, OptionalDouble vibration) {
        if (temperature.isEmpty() || vibration.isEmpty()) {
            return MachineCondition.UNKNOWN;
        }
        double temp = temperature.getAsDouble();
        double vib = vibration.getAsDouble();

        if (temp < Temperature.SAFE_BELOW && vib < Vibration.SAFE_BELOW) {
            return MachineCondition.SAFE;
        }
        if (temp < Temperature.MAINTAIN_BELOW && vib < Vibration.MAINTAIN_BELOW) {
            return MachineCondition.MAINTAIN;
        }
        return MachineCondition.REPAIR;
    }

    public static String temperatureAnomaly(OptionalDouble temperature) {
        if (temperature.isEmpty()) {
            return AnomalyMessages.TEMPERATURE_MISSING;
        }
        double temp = temperature.getAsDouble();

        if (temp < Temperature.SAFE_BELOW) {
            return AnomalyMessages.TEMPERATURE_NORMAL;
        } else if (temp < Temperature.MAINTAIN_BELOW) {
            return AnomalyMessages.TEMPERATURE_MODERATE;
        } else if (temp < Temperature.SIGNIFICANT_BELOW) {
            return AnomalyMessages.TEMPERATURE_SIGNIFICANT;
        }
        return AnomalyMessages.TEMPERATURE_CRITICAL;
    }

    public static String vibrationAnomaly(OptionalDouble vibration) {
        if (vibration.isEmpty()) {
            return AnomalyMessages.VIBRATION_MISSING;
        }
        double vib = vibration.getAsDouble();

        if (vib < Vibration.SAFE_BELOW) {
            return AnomalyMessages.VIBRATION_NORMAL;
        } else if (vib < Vibration.MAINTAIN_BELOW) {
            return AnomalyMessages.VIBRATION_UNBALANCE;
        } else if (vib < Vibration.MISALIGNMENT_BELOW) {
            return AnomalyMessages.VIBRATION_MISALIGNMENT;
        } else if (vib < Vibration.LOOSENESS_BELOW) {
            return AnomalyMessages.VIBRATION_LOOSENESS;
        }
        return AnomalyMessages.VIBRATION_BEARING;
    }
}
