package edu.harvard.hms.dbmi.avillach.phenology.processing;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.SeriesStatistics;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesGroup;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Raw-series statistics shared by both strategies. Works on the observed weekly counts in day order, never on the
 * interpolated or smoothed series.
 */
@Component
public class SeriesStatisticsCalculator {

    public SeriesStatistics calculate(SeriesGroup group) {
        double[] counts = group.rawCounts();
        double[] active = Arrays.stream(counts).filter(c -> c > 0).toArray();

        double total = Arrays.stream(counts).sum();
        double medianAll = median(counts);
        double medianActive = median(active);
        double avgActive = active.length > 0 ? Arrays.stream(active).sum() / active.length : 0;
        double minActive = Arrays.stream(active).min().orElse(0);
        double maxActive = Arrays.stream(active).max().orElse(0);

        return new SeriesStatistics(
            total, active.length, counts.length, medianAll, medianActive, medianCrossings(counts, medianAll), avgActive, minActive,
            maxActive
        );
    }

    /**
     * Middle value, or the mean of the two middle values for an even count. 0 for an empty sample.
     */
    public static double median(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;
    }

    /**
     * Number of adjacent pairs where the series moves from at-or-below the median to above it, or back.
     *
     * <p>A value equal to the median counts as below it, so {@code [0, 0, 0, 5]} with median 0 has one crossing.
     * Splitting instead into below and at-or-above would give none for that series.</p>
     */
    public static int medianCrossings(double[] values, double median) {
        int crossings = 0;
        for (int i = 1; i < values.length; i++) {
            if ((values[i - 1] > median) != (values[i] > median)) {
                crossings++;
            }
        }
        return crossings;
    }
}
