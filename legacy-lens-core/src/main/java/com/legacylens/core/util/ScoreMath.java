package com.legacylens.core.util;

/**
 * Rounding and clamping shared by the scoring code.
 */
public final class ScoreMath {

    private ScoreMath() {
        // Utility class
    }

    /**
     * Rounds half-up to the given number of decimals.
     *
     * @param value value to round
     * @param decimals number of decimals, 0 or more
     * @return rounded value
     */
    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Clamps to [0, 100] and rounds to two decimals.
     *
     * @param value raw score
     * @return bounded score
     */
    public static double percentage(double value) {
        return round(clamp(value, 0.0, 100.0), 2);
    }
}
