package edu.harvard.hms.dbmi.avillach.phenology.data.metrics;

import com.google.common.collect.ImmutableList;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the raw non-zero strategy. All values are exact observed counts. Start and end dates are null when the
 * series has no active week.
 */
public record RawNonZeroMetricsRecord(
    SeriesIdentity identity,
    LocalDate seasonStartDate,
    double seasonStartCount,
    LocalDate peakDate,
    double peakCount,
    LocalDate seasonEndDate,
    double seasonEndCount,
    int durationWeeks,
    long durationDays,
    SeriesStatistics statistics
) implements MetricsRecord {

    public static final List<String> COLUMNS = ImmutableList.<String>builder()
        .addAll(SeriesIdentity.COLUMNS)
        .add(
            "season_start_date", "season_start_count", "peak_date", "peak_count", "season_end_date", "season_end_count",
            "duration_weeks", "duration_days"
        )
        .addAll(SeriesStatistics.COLUMNS)
        .build();

    @Override
    public StrategyType strategy() {
        return StrategyType.RAW_NONZERO;
    }

    @Override
    public Map<String, Object> columns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        identity.putColumns(columns);
        columns.put("season_start_date", seasonStartDate);
        columns.put("season_start_count", MetricValues.count(seasonStartCount));
        columns.put("peak_date", peakDate);
        columns.put("peak_count", MetricValues.count(peakCount));
        columns.put("season_end_date", seasonEndDate);
        columns.put("season_end_count", MetricValues.count(seasonEndCount));
        columns.put("duration_weeks", durationWeeks);
        columns.put("duration_days", durationDays);
        statistics.putColumns(columns);
        return Collections.unmodifiableMap(columns);
    }
}
