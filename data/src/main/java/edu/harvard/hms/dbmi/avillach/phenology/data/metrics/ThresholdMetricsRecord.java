package edu.harvard.hms.dbmi.avillach.phenology.data.metrics;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.phenology.data.series.SeasonWindow;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the smoothed-threshold strategy. Boundary values are smoothed estimates, boundary dates are the last
 * observed dates on or before each boundary day.
 */
public record ThresholdMetricsRecord(
    SeriesIdentity identity,
    double sigma,
    double thresholdPct,
    SeasonWindow window,
    LocalDate startDate,
    LocalDate peakDate,
    LocalDate endDate,
    int seasonWeeks,
    double seasonTotalSearches,
    SeriesStatistics statistics
) implements MetricsRecord {

    public static final List<String> COLUMNS = ImmutableList.<String>builder()
        .addAll(SeriesIdentity.COLUMNS)
        .add(
            "sigma", "threshold_pct", "threshold", "start_doy", "start_date", "start_value_smoothed", "peak_doy", "peak_date",
            "peak_value_smoothed", "end_doy", "end_date", "end_value_smoothed", "duration_days", "season_weeks",
            "season_total_searches"
        )
        .addAll(SeriesStatistics.COLUMNS)
        .build();

    @Override
    public StrategyType strategy() {
        return StrategyType.SMOOTHED_THRESHOLD;
    }

    public int durationDays() {
        return window.durationDays();
    }

    @Override
    public Map<String, Object> columns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        identity.putColumns(columns);
        columns.put("sigma", sigma);
        columns.put("threshold_pct", thresholdPct);
        columns.put("threshold", MetricValues.round(window.threshold(), 3));
        columns.put("start_doy", window.startDoy());
        columns.put("start_date", startDate);
        columns.put("start_value_smoothed", MetricValues.round(window.startValue(), 3));
        columns.put("peak_doy", window.peakDoy());
        columns.put("peak_date", peakDate);
        columns.put("peak_value_smoothed", MetricValues.round(window.peakValue(), 3));
        columns.put("end_doy", window.endDoy());
        columns.put("end_date", endDate);
        columns.put("end_value_smoothed", MetricValues.round(window.endValue(), 3));
        columns.put("duration_days", window.durationDays());
        columns.put("season_weeks", seasonWeeks);
        columns.put("season_total_searches", MetricValues.count(seasonTotalSearches));
        statistics.putColumns(columns);
        return Collections.unmodifiableMap(columns);
    }
}
