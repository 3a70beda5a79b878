package edu.harvard.hms.dbmi.avillach.phenology.data.metrics;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Formatting of numeric column values.
 */
final class MetricValues {

    private MetricValues() {
    }

    /**
     * Half-even rounding of the exact binary value, so 2.25 becomes 2.2 and 2.35 becomes 2.4.
     */
    static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Counts are whole numbers in practice; keep them whole in the output when they are.
     */
    static Number count(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE) {
            return (long) value;
        }
        return value;
    }
}
