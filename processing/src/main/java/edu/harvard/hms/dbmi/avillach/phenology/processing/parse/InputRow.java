package edu.harvard.hms.dbmi.avillach.phenology.processing.parse;

import java.util.Map;

/**
 * One row of the long-format input table: column name to raw cell text. {@code rowNumber} is the 1-based record
 * number in the source, used in failure reports.
 */
public record InputRow(long rowNumber, Map<String, String> values) {

    public String get(String column) {
        return values.get(column);
    }
}
