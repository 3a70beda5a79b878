package edu.harvard.hms.dbmi.avillach.phenology.service.failure;

import com.fasterxml.jackson.annotation.JsonInclude;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesKey;
import edu.harvard.hms.dbmi.avillach.phenology.processing.ProcessingFailure;

/**
 * JSONL record for failure capture. Row failures carry the row number and column, series failures carry the
 * series identity.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailureRecord(
    String runId,
    String inputFile,
    String strategy,
    Long rowNumber,
    String location,
    String searchTerm,
    Integer year,
    String column,
    String valueRaw,
    FailureReason reasonCode,
    String reasonDetail
) {

    public static FailureRecord of(String runId, String inputFile, String strategy, ProcessingFailure failure) {
        SeriesKey key = failure.seriesKey();
        return new FailureRecord(
            runId,
            inputFile,
            strategy,
            failure.rowNumber(),
            key != null ? key.location() : null,
            key != null ? key.searchTerm() : null,
            key != null ? key.year() : null,
            failure.column(),
            failure.rawValue(),
            FailureReason.of(failure.kind()),
            failure.message()
        );
    }
}
