package com.taxprep.fdg.node;

/**
 * Arithmetic over optional line values. A {@code null} value means "not
 * applicable".
 */
public final class Lines {
    private Lines() {
        // Utility class
    }

    /** Sums the values, treating absent ones as zero. */
    public static double sum(Double... values) {
        double total = 0;
        for (Double v : values)
            if (v != null)
                total += v;
        return total;
    }

    /**
     * Sums the values when at least one is present. Returns null when every
     * value is absent, so "not applicable" is never reported as zero.
     */
    public static Double sumPresent(Double... values) {
        double total = 0;
        boolean any = false;
        for (Double v : values) {
            if (v != null) {
                total += v;
                any = true;
            }
        }
        return any ? total : null;
    }

    public static double orZero(Double value) {
        return value == null ? 0 : value;
    }

    /** Null for zero, the value otherwise. Used for lines left blank when empty. */
    public static Double blankIfZero(double value) {
        return value == 0 ? null : value;
    }

    /** Rounds to whole cents. */
    public static double cents(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
