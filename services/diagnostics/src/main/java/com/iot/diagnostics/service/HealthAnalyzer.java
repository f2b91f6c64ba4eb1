package com.iot.diagnostics.service;

import com.iot.common.dto.diagnosis.DataCompleteness;
import com.iot.common.dto.diagnosis.HealthDiagnosis;
import com.iot.common.model.HealthVerdict;
import com.iot.common.model.MachineCondition;
import com.iot.common.model.SensorField;
import com.iot.common.model.SensorReading;
import com.iot.common.rules.ConditionRules;
import com.iot.common.util.SensorValues;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Rule-based diagnosis of one record from its averaged temperature and vibration.
 */
@Service
public class HealthAnalyzer {

    private final Clock clock;

    public HealthAnalyzer(Clock clock) {
        this.clock = clock;
    }

    public HealthDiagnosis analyze(SensorReading reading) {
        OptionalDouble avgTemperature = SensorValues.safeMean(reading.valuesOf(SensorField.TEMPERATURE));
        OptionalDouble avgVibration = SensorValues.safeMean(reading.valuesOf(SensorField.VIBRATION));

        MachineCondition condition = ConditionRules.machineCondition(avgTemperature, avgVibration);

        return new HealthDiagnosis(
                condition,
                ConditionRules.temperatureAnomaly(avgTemperature),
                ConditionRules.vibrationAnomaly(avgVibration),
                DataCompleteness.of(avgTemperature.isPresent(), avgVibration.isPresent()),
                Instant.now(clock),
                HealthVerdict.of(condition)
        );
    }
}
