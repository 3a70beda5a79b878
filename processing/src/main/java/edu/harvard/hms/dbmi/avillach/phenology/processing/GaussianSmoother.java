package edu.harvard.hms.dbmi.avillach.phenology.processing;

import edu.harvard.hms.dbmi.avillach.phenology.data.series.ContinuousSeries;
import edu.harvard.hms.dbmi.avillach.phenology.data.series.SmoothedSeries;
import org.springframework.stereotype.Component;

/**
 * One-dimensional Gaussian filter.
 *
 * <p>The kernel is truncated at {@value #TRUNCATE} standard deviations, radius {@code (int) (4 * sigma + 0.5)},
 * with weights {@code exp(-x^2 / (2 sigma^2))} normalised to sum to one. Samples beyond either end are mirrored
 * about the edge, half-sample symmetric ({@code d c b a | a b c d | d c b a}), repeating as often as the radius
 * requires. Output is deterministic for a given input and sigma.</p>
 *
 * <p>Mirroring makes the extended input periodic with period {@code 2 * length}. When the kernel is at least that
 * wide its weights are folded onto one period, so memory stays bounded by the series length.</p>
 */
@Component
public class GaussianSmoother {

    static final double TRUNCATE = 4.0;

    public SmoothedSeries smooth(ContinuousSeries series, double sigma) {
        PhenologyParameters.validateSigma(sigma);
        double[] input = series.getValues();
        int period = 2 * input.length;
        double[] output = new double[input.length];

        if (2 * radius(sigma) + 1 <= period) {
            double[] kernel = kernel(sigma);
            int radius = kernel.length / 2;
            for (int i = 0; i < input.length; i++) {
                double sum = 0;
                for (int k = -radius; k <= radius; k++) {
                    sum += kernel[k + radius] * input[reflect(i + k, input.length)];
                }
                output[i] = sum;
            }
        } else {
            double[] weights = foldedKernel(sigma, period);
            for (int i = 0; i < input.length; i++) {
                double sum = 0;
                for (int m = 0; m < period; m++) {
                    sum += weights[m] * input[reflect(i + m, input.length)];
                }
                output[i] = sum;
            }
        }
        return new SmoothedSeries(series.getFirstDay(), output, sigma);
    }

    static int radius(double sigma) {
        return (int) (TRUNCATE * sigma + 0.5);
    }

    static double[] kernel(double sigma) {
        int radius = radius(sigma);
        double[] weights = new double[2 * radius + 1];
        double total = 0;
        for (int x = -radius; x <= radius; x++) {
            double weight = Math.exp(-0.5 * x * x / (sigma * sigma));
            weights[x + radius] = weight;
            total += weight;
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] /= total;
        }
        return weights;
    }

    /**
     * Kernel weights summed by offset modulo {@code period}. Weight {@code m} applies to every offset congruent to it.
     */
    static double[] foldedKernel(double sigma, int period) {
        int radius = radius(sigma);
        double[] weights = new double[period];
        double total = 0;
        for (int x = -radius; x <= radius; x++) {
            double weight = Math.exp(-0.5 * x * x / (sigma * sigma));
            weights[Math.floorMod(x, period)] += weight;
            total += weight;
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] /= total;
        }
        return weights;
    }

    static int reflect(int index, int length) {
        int period = 2 * length;
        int folded = Math.floorMod(index, period);
        return folded < length ? folded : period - 1 - folded;
    }
}
