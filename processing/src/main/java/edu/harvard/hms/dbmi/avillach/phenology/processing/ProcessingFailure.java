package edu.harvard.hms.dbmi.avillach.phenology.processing;

import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesKey;

/**
 * A row or group that produced no output. Row failures carry the row number and offending column, group failures
 * carry the series key.
 */
public record ProcessingFailure(
    Kind kind,
    Long rowNumber,
    SeriesKey seriesKey,
    String column,
    String rawValue,
    String message
) {

    public enum Kind {
        MALFORMED_OBSERVATION,
        INSUFFICIENT_DATA,
        INVALID_PARAMETER,
        GROUP_FAILED
    }

    public static ProcessingFailure forRow(long rowNumber, String column, String rawValue, String message) {
        return new ProcessingFailure(Kind.MALFORMED_OBSERVATION, rowNumber, null, column, rawValue, message);
    }

    public static ProcessingFailure forGroup(Kind kind, SeriesKey seriesKey, String message) {
        return new ProcessingFailure(kind, null, seriesKey, null, null, message);
    }
}
