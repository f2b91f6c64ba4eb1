package com.iot.common.rules;

import com.iot.common.model.MachineCondition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class ConditionRulesTest {

    private static OptionalDouble v(double value) {
        return OptionalDouble.of(value);
    }

    @Test
    void machineCondition_safeBelowBothThresholds() {
        assertEquals(MachineCondition.SAFE, ConditionRules.machineCondition(v(79.9), v(1.7)));
    }

    @Test
    void machineCondition_boundaryBelongsToHigherBand() {
        assertEquals(MachineCondition.MAINTAIN, ConditionRules.machineCondition(v(80.0), v(1.7)));
        assertEquals(MachineCondition.MAINTAIN, ConditionRules.machineCondition(v(70.0), v(1.8)));
        assertEquals(MachineCondition.REPAIR, ConditionRules.machineCondition(v(100.0), v(1.0)));
        assertEquals(MachineCondition.REPAIR, ConditionRules.machineCondition(v(70.0), v(2.8)));
    }

    @Test
    void machineCondition_unknownWhenEitherAverageMissing() {
        assertEquals(MachineCondition.UNKNOWN, ConditionRules.machineCondition(OptionalDouble.empty(), v(1.0)));
        assertEquals(MachineCondition.UNKNOWN, ConditionRules.machineCondition(v(70.0), OptionalDouble.empty()));
        assertEquals("Unknown Condition - Insufficient Data",
                ConditionRules.machineCondition(OptionalDouble.empty(), OptionalDouble.empty()).getLabel());
    }

    @ParameterizedTest
    @CsvSource({
            "79.99, No temperature anomaly detected",
            "80.0, Moderate temperature anomaly: elevated operating temperature",
            "99.99, Moderate temperature anomaly: elevated operating temperature",
            "100.0, Significant temperature anomaly: overheating risk",
            "120.0, Critical temperature anomaly: immediate shutdown recommended",
            "-10.0, No temperature anomaly detected"
    })
    void temperatureAnomaly_bucketsHalfOpen(double temperature, String expected) {
        assertEquals(expected, ConditionRules.temperatureAnomaly(v(temperature)));
    }

    @ParameterizedTest
    @CsvSource({
            "1.79, No vibration anomaly detected",
            "1.8, Unbalance fault suspected",
            "2.8, Misalignment fault suspected",
            "4.49, Misalignment fault suspected",
            "4.5, Looseness fault suspected",
            "7.1, Bearing or gear mesh fault suspected",
            "15.0, Bearing or gear mesh fault suspected"
    })
    void vibrationAnomaly_bucketsHalfOpen(double vibration, String expected) {
        assertEquals(expected, ConditionRules.vibrationAnomaly(v(vibration)));
    }

    @Test
    void anomalies_reportMissingData() {
        assertEquals(AnomalyMessages.TEMPERATURE_MISSING, ConditionRules.temperatureAnomaly(OptionalDouble.empty()));
        assertEquals(AnomalyMessages.VIBRATION_MISSING, ConditionRules.vibrationAnomaly(OptionalDouble.empty()));
    }
}
