package edu.harvard.hms.dbmi.avillach.phenology.processing;

import edu.harvard.hms.dbmi.avillach.phenology.data.observation.Observation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Observations parsed so far in a batch, with the row failures and counters. Filled one input batch at a time by
 * {@link PhenologyProcessor#parse}, so raw rows can be released once parsed. Not thread-safe.
 */
public class ParsedObservations {

    private final List<Observation> observations = new ArrayList<>();

    private final List<ProcessingFailure> failures = new ArrayList<>();

    private long rowsRead;

    private long countsCoerced;

    void accept(Observation observation, boolean countCoerced) {
        rowsRead++;
        observations.add(observation);
        if (countCoerced) {
            countsCoerced++;
        }
    }

    void reject(ProcessingFailure failure) {
        rowsRead++;
        failures.add(failure);
    }

    public List<Observation> getObservations() {
        return Collections.unmodifiableList(observations);
    }

    public List<ProcessingFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public long getRowsRead() {
        return rowsRead;
    }

    public long getRowsRejected() {
        return failures.size();
    }

    public long getCountsCoerced() {
        return countsCoerced;
    }
}
