package org.calista.accuracy.core;

/**
 * Centralized threshold constants.
 *
 * <pre>
 * difficulty   : score &lt; 0.35 easy, score &gt; 0.65 hard, otherwise medium
 * calibration  : score &gt;= 0.7 high, score &gt;= 0.4 medium, otherwise low
 * critique     : severity &gt; 0.3 is worth refining
 * </pre>
 */
public final class Thresholds {

    private Thresholds() {}

    // difficulty
    public static final double EASY = 0.35;
    public static final double HARD = 0.65;

    // calibration gate defaults
    public static final double CALIBRATION_HIGH = 0.7;
    public static final double CALIBRATION_LOW = 0.4;

    // critique
    public static final double REFINE_SEVERITY = 0.3;

    /** Tolerance when comparing gate thresholds. */
    public static final double FLOAT_EPSILON = 1e-4;

    public static boolean isUnitInterval(double x) {
        return Double.isFinite(x) && x >= 0.0 && x <= 1.0;
    }
}
