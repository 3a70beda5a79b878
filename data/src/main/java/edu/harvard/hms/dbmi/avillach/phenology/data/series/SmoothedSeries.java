package edu.harvard.hms.dbmi.avillach.phenology.data.series;

/**
 * Gaussian-filtered {@link ContinuousSeries}. Same day domain as the series it was built from.
 */
public class SmoothedSeries extends DailySeries {

    private final double sigma;

    public SmoothedSeries(int firstDay, double[] values, double sigma) {
        super(firstDay, values);
        this.sigma = sigma;
    }

    public double getSigma() {
        return sigma;
    }
}
