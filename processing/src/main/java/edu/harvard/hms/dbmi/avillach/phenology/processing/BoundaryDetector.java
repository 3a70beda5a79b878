package edu.harvard.hms.dbmi.avillach.phenology.processing;

import edu.harvard.hms.dbmi.avillach.phenology.data.series.SeasonWindow;
import edu.harvard.hms.dbmi.avillach.phenology.data.series.SmoothedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds season start, peak and end in a smoothed series.
 *
 * <ol>
 *   <li>threshold = min + pct / 100 * (max - min)</li>
 *   <li>peak: first day holding the maximum</li>
 *   <li>start: first day before the peak whose value is above the threshold, else the first day of the series</li>
 *   <li>end: first day after the peak whose value is at or below the threshold, else the last day of the series</li>
 * </ol>
 *
 * A flat series has nothing to separate from its baseline, so its window spans the whole series with the peak on the
 * first day. Every scan runs forward so the earliest day wins ties.
 */
@Component
public class BoundaryDetector {

    private static final Logger log = LoggerFactory.getLogger(BoundaryDetector.class);

    public SeasonWindow detect(SmoothedSeries series, double thresholdPct) {
        PhenologyParameters.validateThresholdPct(thresholdPct);
        double min = series.min();
        double max = series.max();
        int last = series.size() - 1;

        if (max == min) {
            log.debug("Flat series from day {} to {}, window spans the whole series", series.getFirstDay(), series.getLastDay());
            return window(series, 0, 0, last, min);
        }

        double threshold = min + (thresholdPct / 100) * (max - min);

        int peak = 0;
        for (int i = 1; i <= last; i++) {
            if (series.valueAt(i) > series.valueAt(peak)) {
                peak = i;
            }
        }

        int start = 0;
        for (int i = 0; i < peak; i++) {
            if (series.valueAt(i) > threshold) {
                start = i;
                break;
            }
        }

        int end = last;
        for (int i = peak + 1; i <= last; i++) {
            if (series.valueAt(i) <= threshold) {
                end = i;
                break;
            }
        }

        return window(series, start, peak, end, threshold);
    }

    private static SeasonWindow window(SmoothedSeries series, int start, int peak, int end, double threshold) {
        return new SeasonWindow(
            series.dayAt(start), series.dayAt(peak), series.dayAt(end), series.valueAt(start), series.valueAt(peak),
            series.valueAt(end), threshold
        );
    }
}
