package com.iot.common.rules;

/**
 * Fixed breakpoints for the condition rules.
 * Every band is half-open: lower bound inclusive, upper bound exclusive.
 */
public final class ConditionThresholds {

    private ConditionThresholds() {} // Prevent instantiation

    /**
     * Averaged temperature breakpoints (°C).
     */
    public static class Temperature {
        public static final double SAFE_BELOW = 80.0;
        public static final double MAINTAIN_BELOW = 100.0;
        public static final double SIGNIFICANT_BELOW = 120.0;
    }

    /**
     * Averaged vibration breakpoints (mm/s RMS, ISO 10816 style zones).
     */
    public static class Vibration {
        public static final double SAFE_BELOW = 1.8;
        public static final double MAINTAIN_BELOW = 2.8;
        public static final double MISALIGNMENT_BELOW = 4.5;
        public static final double LOOSENESS_BELOW = 7.1;
    }
}
