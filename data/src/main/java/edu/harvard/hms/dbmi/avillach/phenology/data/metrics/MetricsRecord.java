package edu.harvard.hms.dbmi.avillach.phenology.data.metrics;

import java.util.Map;

/**
 * One output row per analysed series. The column set and order are fixed per {@link StrategyType}.
 */
public interface MetricsRecord {

    StrategyType strategy();

    SeriesIdentity identity();

    SeriesStatistics statistics();

    /**
     * Column name to value, in {@link StrategyType#columnNames()} order. Values are strings, numbers, dates or null.
     */
    Map<String, Object> columns();
}
