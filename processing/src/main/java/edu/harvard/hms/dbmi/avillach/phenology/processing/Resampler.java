package edu.harvard.hms.dbmi.avillach.phenology.processing;

import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesGroup;
import edu.harvard.hms.dbmi.avillach.phenology.data.series.ContinuousSeries;
import edu.harvard.hms.dbmi.avillach.phenology.exception.InsufficientDataException;
import org.springframework.stereotype.Component;

/**
 * Linear resampling of an irregular weekly series onto every day between its first and last observation.
 *
 * <p>Where a day was sampled more than once, the first sample in input order is that day's value. Between sampled
 * days, the segment runs from the last sample at or before the day to the first sample after it. Days outside the
 * sampled range are extrapolated along the nearest segment.</p>
 */
@Component
public class Resampler {

    public ContinuousSeries resample(SeriesGroup group) {
        if (group.isEmpty()) {
            throw new InsufficientDataException("Cannot resample series " + group.getKey() + " without observations");
        }
        return resample(group.days(), group.rawCounts());
    }

    /**
     * @param days observed days of year, ascending
     * @param counts counts at those days
     */
    public ContinuousSeries resample(int[] days, double[] counts) {
        if (days.length == 0) {
            throw new InsufficientDataException("Cannot resample a series without observations");
        }
        if (days.length != counts.length) {
            throw new IllegalArgumentException("days and counts differ in length: " + days.length + " vs " + counts.length);
        }
        for (int i = 1; i < days.length; i++) {
            if (days[i] < days[i - 1]) {
                throw new IllegalArgumentException("days must be ascending, found " + days[i - 1] + " before " + days[i]);
            }
        }

        int firstDay = days[0];
        double[] values = new double[days[days.length - 1] - firstDay + 1];
        for (int i = 0; i < values.length; i++) {
            values[i] = interpolate(days, counts, firstDay + i);
        }
        return new ContinuousSeries(firstDay, values);
    }

    static double interpolate(int[] days, double[] counts, int day) {
        int n = days.length;
        int lastAtOrBefore = -1;
        for (int i = 0; i < n && days[i] <= day; i++) {
            if (days[i] == day) {
                return counts[i];
            }
            lastAtOrBefore = i;
        }
        int firstAfter = lastAtOrBefore + 1;

        if (lastAtOrBefore == -1) {
            // left of the first sample: extend the first segment
            lastAtOrBefore = lastIndexOfDay(days, 0);
            firstAfter = lastAtOrBefore + 1;
            if (firstAfter == n) {
                return counts[0];
            }
        } else if (firstAfter == n) {
            // right of the last sample: extend the last segment
            firstAfter = firstIndexOfDay(days, n - 1);
            lastAtOrBefore = firstAfter - 1;
            if (lastAtOrBefore < 0) {
                return counts[firstAfter];
            }
        }

        double slope = (counts[firstAfter] - counts[lastAtOrBefore]) / (days[firstAfter] - days[lastAtOrBefore]);
        return counts[lastAtOrBefore] + slope * (day - days[lastAtOrBefore]);
    }

    private static int lastIndexOfDay(int[] days, int index) {
        while (index + 1 < days.length && days[index + 1] == days[index]) {
            index++;
        }
        return index;
    }

    private static int firstIndexOfDay(int[] days, int index) {
        while (index > 0 && days[index - 1] == days[index]) {
            index--;
        }
        return index;
    }
}
