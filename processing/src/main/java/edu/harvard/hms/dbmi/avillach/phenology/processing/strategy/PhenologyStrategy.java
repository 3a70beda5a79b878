package edu.harvard.hms.dbmi.avillach.phenology.processing.strategy;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.MetricsRecord;
import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.StrategyType;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesGroup;
import edu.harvard.hms.dbmi.avillach.phenology.processing.PhenologyParameters;

/**
 * A season detection algorithm. Implementations hold no per-call state and may analyse groups concurrently.
 */
public interface PhenologyStrategy {

    StrategyType type();

    /**
     * @param group a non-empty series
     */
    MetricsRecord analyze(SeriesGroup group, PhenologyParameters parameters);
}
