package edu.harvard.hms.dbmi.avillach.phenology.data.metrics;

import java.util.List;
import java.util.Map;

/**
 * Raw-series statistics common to both strategies. Active-week figures are 0 when no week is active.
 */
public record SeriesStatistics(
    double totalSearches,
    int numActiveWeeks,
    int totalWeeks,
    double medianAllWeeks,
    double medianActiveWeeks,
    int medianCrossings,
    double avgCountActiveWeeks,
    double minCountActiveWeeks,
    double maxCountActiveWeeks
) {

    static final List<String> COLUMNS = List.of(
        "num_active_weeks", "total_weeks", "median_all_weeks", "median_active_weeks", "median_crossings",
        "avg_count_active_weeks", "min_count_active_weeks", "max_count_active_weeks", "total_searches"
    );

    void putColumns(Map<String, Object> columns) {
        columns.put("num_active_weeks", numActiveWeeks);
        columns.put("total_weeks", totalWeeks);
        columns.put("median_all_weeks", MetricValues.round(medianAllWeeks, 1));
        columns.put("median_active_weeks", MetricValues.round(medianActiveWeeks, 1));
        columns.put("median_crossings", medianCrossings);
        columns.put("avg_count_active_weeks", MetricValues.round(avgCountActiveWeeks, 1));
        columns.put("min_count_active_weeks", MetricValues.count(minCountActiveWeeks));
        columns.put("max_count_active_weeks", MetricValues.count(maxCountActiveWeeks));
        columns.put("total_searches", MetricValues.count(totalSearches));
    }
}
