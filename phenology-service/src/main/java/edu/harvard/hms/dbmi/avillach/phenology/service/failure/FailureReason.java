package edu.harvard.hms.dbmi.avillach.phenology.service.failure;

import edu.harvard.hms.dbmi.avillach.phenology.processing.ProcessingFailure;

/**
 * Stable enumeration of failure reasons written to the failure log.
 */
public enum FailureReason {
    MALFORMED_OBSERVATION("Row could not be parsed into an observation"),
    INSUFFICIENT_DATA("Series has no observations to analyse"),
    INVALID_PARAMETER("Algorithm parameter rejected"),
    GROUP_FAILED("Series analysis failed"),
    FILE_READ_ERROR("Unable to read source file"),
    UNKNOWN("Unknown failure");

    private final String description;

    FailureReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static FailureReason of(ProcessingFailure.Kind kind) {
        return switch (kind) {
            case MALFORMED_OBSERVATION -> MALFORMED_OBSERVATION;
            case INSUFFICIENT_DATA -> INSUFFICIENT_DATA;
            case INVALID_PARAMETER -> INVALID_PARAMETER;
            case GROUP_FAILED -> GROUP_FAILED;
        };
    }
}
