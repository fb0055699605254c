package com.reflectionplatform.correlation.model;

/**
 * Strength bucket of a correlation, a pure function of {@code |r|}.
 *
 * <pre>
 *   |r| &gt;= 0.7         STRONG
 *   0.4 &lt;= |r| &lt; 0.7   MODERATE
 *   0.2 &lt;= |r| &lt; 0.4   WEAK
 *   |r| &lt; 0.2          NONE
 * </pre>
 */
public enum Significance {

    STRONG,
    MODERATE,
    WEAK,
    NONE;

    private static final double STRONG_THRESHOLD   = 0.7;
    private static final double MODERATE_THRESHOLD = 0.4;
    private static final double WEAK_THRESHOLD     = 0.2;

    public static Significance classify(double coefficient) {
        double magnitude = Math.abs(coefficient);
        if (Double.isNaN(magnitude)) return NONE;
        if (magnitude >= STRONG_THRESHOLD)   return STRONG;
        if (magnitude >= MODERATE_THRESHOLD) return MODERATE;
        if (magnitude >= WEAK_THRESHOLD)     return WEAK;
        return NONE;
    }

    /** Whether results in this bucket are turned into suggestions. */
    public boolean actionable() {
        return this == STRONG || this == MODERATE;
    }
}
