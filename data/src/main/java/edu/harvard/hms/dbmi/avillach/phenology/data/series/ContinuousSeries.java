package edu.harvard.hms.dbmi.avillach.phenology.data.series;

/**
 * Raw weekly counts resampled onto every day between the first and last observed day.
 */
public class ContinuousSeries extends DailySeries {

    public ContinuousSeries(int firstDay, double[] values) {
        super(firstDay, values);
    }
}
