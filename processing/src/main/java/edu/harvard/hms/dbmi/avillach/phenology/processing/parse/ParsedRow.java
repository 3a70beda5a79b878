package edu.harvard.hms.dbmi.avillach.phenology.processing.parse;

import edu.harvard.hms.dbmi.avillach.phenology.data.observation.Observation;

/**
 * @param countCoerced true when the search count cell was blank or non-numeric and was read as 0
 */
public record ParsedRow(Observation observation, boolean countCoerced) {
}
