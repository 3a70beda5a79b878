package edu.harvard.hms.dbmi.avillach.phenology.data.series;

import com.google.common.collect.Range;

/**
 * Start, peak and end of a detected season, in days of year, with the smoothed values at those days and the
 * threshold that separated the season from the baseline.
 */
public record SeasonWindow(
    int startDoy,
    int peakDoy,
    int endDoy,
    double startValue,
    double peakValue,
    double endValue,
    double threshold
) {

    public SeasonWindow {
        if (startDoy > peakDoy || peakDoy > endDoy) {
            throw new IllegalArgumentException(
                "Season boundaries out of order: start=" + startDoy + " peak=" + peakDoy + " end=" + endDoy
            );
        }
    }

    public int durationDays() {
        return endDoy - startDoy;
    }

    /**
     * Closed day-of-year range from start to end.
     */
    public Range<Integer> days() {
        return Range.closed(startDoy, endDoy);
    }
}
