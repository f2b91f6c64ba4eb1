package com.iot.diagnostics.service;

import com.iot.common.dto.diagnosis.HealthDiagnosis;
import com.iot.common.model.Completeness;
import com.iot.common.model.HealthVerdict;
import com.iot.common.model.MachineCondition;
import com.iot.common.model.SensorReading;
import com.iot.common.rules.AnomalyMessages;
import com.iot.diagnostics.TestModels;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthAnalyzerTest {

    private static final Instant NOW = Instant.parse("2026-01-13T11:00:00Z");

    private final HealthAnalyzer analyzer = new HealthAnalyzer(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void healthyRecordIsSafe() {
        HealthDiagnosis diagnosis = analyzer.analyze(TestModels.healthyReading());

        assertEquals(MachineCondition.SAFE, diagnosis.machineCondition());
        assertEquals(HealthVerdict.HEALTHY, diagnosis.overallHealth());
        assertEquals(AnomalyMessages.TEMPERATURE_NORMAL, diagnosis.temperatureAnalysis());
        assertEquals(AnomalyMessages.VIBRATION_NORMAL, diagnosis.vibrationAnalysis());
        assertTrue(diagnosis.dataCompleteness().isComplete());
        assertEquals(NOW, diagnosis.timestamp());
    }

    @Test
    void averagesIgnoreInvalidAxes() {
        Map<String, Object> values = TestModels.healthyValues();
        values.put("temperature_one", null);
        values.put("temperature_two", 90.0);
        values.put("vibration_x", "garbage");
        values.put("vibration_y", 2.0);
        values.put("vibration_z", 2.2);

        HealthDiagnosis diagnosis = analyzer.analyze(SensorReading.of(values));

        assertEquals(MachineCondition.MAINTAIN, diagnosis.machineCondition());
        assertEquals(HealthVerdict.UNHEALTHY, diagnosis.overallHealth());
        assertEquals(AnomalyMessages.TEMPERATURE_MODERATE, diagnosis.temperatureAnalysis());
        assertEquals(AnomalyMessages.VIBRATION_UNBALANCE, diagnosis.vibrationAnalysis());
    }

    @Test
    void severeReadingsNeedRepair() {
        Map<String, Object> values = TestModels.healthyValues();
        values.put("temperature_one", 125.0);
        values.put("temperature_two", 121.0);
        values.put("vibration_x", 8.0);

        HealthDiagnosis diagnosis = analyzer.analyze(SensorReading.of(values));

        assertEquals(MachineCondition.REPAIR, diagnosis.machineCondition());
        assertEquals(HealthVerdict.UNHEALTHY, diagnosis.overallHealth());
        assertEquals(AnomalyMessages.TEMPERATURE_CRITICAL, diagnosis.temperatureAnalysis());
    }

    @Test
    void missingVibrationIsUnknown() {
        Map<String, Object> values = TestModels.healthyValues();
        values.remove("vibration_x");
        values.remove("vibration_y");
        values.put("vibration_z", Double.NaN);

        HealthDiagnosis diagnosis = analyzer.analyze(SensorReading.of(values));

        assertEquals(MachineCondition.UNKNOWN, diagnosis.machineCondition());
        assertEquals(HealthVerdict.UNKNOWN, diagnosis.overallHealth());
        assertEquals(AnomalyMessages.VIBRATION_MISSING, diagnosis.vibrationAnalysis());
        assertEquals(Completeness.COMPLETE, diagnosis.dataCompleteness().temperature());
        assertEquals(Completeness.INCOMPLETE, diagnosis.dataCompleteness().vibration());
        assertTrue(diagnosis.hasInsufficientData());
    }
}
