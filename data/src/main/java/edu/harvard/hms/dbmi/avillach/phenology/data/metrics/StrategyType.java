package edu.harvard.hms.dbmi.avillach.phenology.data.metrics;

import edu.harvard.hms.dbmi.avillach.phenology.exception.InvalidParameterException;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The two season detection algorithms. They produce different record shapes and are never mixed in one output.
 */
public enum StrategyType {
    /** Interpolate, smooth, and detect boundaries against a dynamic threshold. */
    SMOOTHED_THRESHOLD("smoothed-threshold"),
    /** First and last non-zero raw observation bound the season, the raw maximum is the peak. */
    RAW_NONZERO("raw-nonzero");

    private final String label;

    StrategyType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public List<String> columnNames() {
        return switch (this) {
            case SMOOTHED_THRESHOLD -> ThresholdMetricsRecord.COLUMNS;
            case RAW_NONZERO -> RawNonZeroMetricsRecord.COLUMNS;
        };
    }

    /**
     * Accepts either the label ({@code smoothed-threshold}) or the constant name ({@code SMOOTHED_THRESHOLD}),
     * case-insensitively.
     */
    public static StrategyType fromLabel(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (StrategyType type : values()) {
                if (type.label.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                    return type;
                }
            }
        }
        String known = Arrays.stream(values()).map(StrategyType::getLabel).collect(Collectors.joining(", "));
        throw new InvalidParameterException("strategy", "unknown strategy '" + value + "', expected one of " + known);
    }
}
