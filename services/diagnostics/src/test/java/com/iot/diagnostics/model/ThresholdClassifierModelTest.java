package com.iot.diagnostics.model;

import com.iot.diagnostics.model.ThresholdClassifierModel.Band;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdClassifierModelTest {

    private final ThresholdClassifierModel model = new ThresholdClassifierModel(
            List.of(new Band(1.8, "Normal"), new Band(2.8, "Unbalance")), "Fault");

    @Test
    void classifiesMeanIntoHalfOpenBands() {
        assertEquals("Normal", model.predict(Map.of("vibration_x", 1.0, "vibration_y", 2.0)));
        assertEquals("Unbalance", model.predict(Map.of("vibration_x", 1.8)));
        assertEquals("Fault", model.predict(Map.of("vibration_x", 2.8)));
    }

    @Test
    void requiresIncreasingBands() {
        assertThrows(IllegalArgumentException.class, () -> new ThresholdClassifierModel(
                List.of(new Band(2.8, "a"), new Band(1.8, "b")), "c"));
        assertThrows(IllegalArgumentException.class, () -> new ThresholdClassifierModel(List.of(), "c"));
    }

    @Test
    void rejectsEmptyFeatureVector() {
        assertThrows(IllegalArgumentException.class, () -> model.predict(Map.of()));
    }
}
