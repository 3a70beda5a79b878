package edu.harvard.hms.dbmi.avillach.phenology.processing.parse;

import java.util.Set;

/**
 * Detects string representations of missing data in input cells.
 *
 * <p>Exports from dataframe tooling write missing cells as "", "nan", "NaN", "None", "null", "N/A" and so on. These
 * are treated as absent rather than as unparseable text. Matching is case-insensitive and whitespace is trimmed.</p>
 */
public class NullSentinelDetector {

    private static final Set<String> NULL_SENTINELS = Set.of(
        "",
        "nan",
        "na",
        "n/a",
        "null",
        "none"
    );

    public boolean isNullSentinel(String value) {
        return value == null || NULL_SENTINELS.contains(value.trim().toLowerCase());
    }
}
