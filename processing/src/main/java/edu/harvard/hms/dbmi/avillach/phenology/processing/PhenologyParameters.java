package edu.harvard.hms.dbmi.avillach.phenology.processing;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.StrategyType;
import edu.harvard.hms.dbmi.avillach.phenology.exception.InvalidParameterException;

import java.util.Objects;

/**
 * Algorithm parameters for one batch.
 *
 * @param sigma width of the Gaussian smoothing kernel in days, positive and at most {@value #MAX_SIGMA}
 * @param thresholdPct threshold height as a percentage of the smoothed range, 10 to 50 in practice, anything in
 *        (0, 100) is accepted
 * @param strategy season detection algorithm
 */
public record PhenologyParameters(double sigma, double thresholdPct, StrategyType strategy) {

    public static final double DEFAULT_SIGMA = 4;

    public static final double DEFAULT_THRESHOLD_PCT = 20;

    /**
     * Upper bound on sigma in days. Building the kernel takes time proportional to it.
     */
    public static final double MAX_SIGMA = 1_000_000;

    public PhenologyParameters {
        validateSigma(sigma);
        validateThresholdPct(thresholdPct);
        Objects.requireNonNull(strategy, "strategy");
    }

    public static PhenologyParameters defaults() {
        return new PhenologyParameters(DEFAULT_SIGMA, DEFAULT_THRESHOLD_PCT, StrategyType.SMOOTHED_THRESHOLD);
    }

    public static void validateSigma(double sigma) {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new InvalidParameterException("sigma", "must be a positive finite number, was " + sigma);
        }
        if (sigma > MAX_SIGMA) {
            throw new InvalidParameterException("sigma", "must be at most " + MAX_SIGMA + ", was " + sigma);
        }
    }

    public static void validateThresholdPct(double thresholdPct) {
        if (!(thresholdPct > 0 && thresholdPct < 100)) {
            throw new InvalidParameterException("threshold_pct", "must be greater than 0 and less than 100, was " + thresholdPct);
        }
    }
}
