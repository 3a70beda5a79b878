package edu.harvard.hms.dbmi.avillach.phenology.processing.strategy;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.RawNonZeroMetricsRecord;
import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.SeriesIdentity;
import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.StrategyType;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.Observation;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesGroup;
import edu.harvard.hms.dbmi.avillach.phenology.exception.InsufficientDataException;
import edu.harvard.hms.dbmi.avillach.phenology.processing.PhenologyParameters;
import edu.harvard.hms.dbmi.avillach.phenology.processing.SeriesStatisticsCalculator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Season bounded by the first and last active week of the raw series, peak at the first raw maximum. No
 * interpolation or smoothing, so every reported value is an observed count.
 *
 * A series with no active week gets no start or end date, zero durations, and its first observation as the peak.
 */
@Component
public class RawNonZeroStrategy implements PhenologyStrategy {

    private final SeriesStatisticsCalculator statisticsCalculator;

    @Autowired
    public RawNonZeroStrategy(SeriesStatisticsCalculator statisticsCalculator) {
        this.statisticsCalculator = statisticsCalculator;
    }

    public RawNonZeroStrategy() {
        this(new SeriesStatisticsCalculator());
    }

    @Override
    public StrategyType type() {
        return StrategyType.RAW_NONZERO;
    }

    @Override
    public RawNonZeroMetricsRecord analyze(SeriesGroup group, PhenologyParameters parameters) {
        if (group.isEmpty()) {
            throw new InsufficientDataException("Series " + group.getKey() + " has no observations");
        }
        List<Observation> observations = group.getObservations();

        int startIdx = -1;
        int endIdx = -1;
        int peakIdx = 0;
        for (int i = 0; i < observations.size(); i++) {
            Observation observation = observations.get(i);
            if (observation.isActive()) {
                if (startIdx < 0) {
                    startIdx = i;
                }
                endIdx = i;
            }
            if (observation.rawCount() > observations.get(peakIdx).rawCount()) {
                peakIdx = i;
            }
        }

        Observation peak = observations.get(peakIdx);
        if (startIdx < 0) {
            return new RawNonZeroMetricsRecord(
                SeriesIdentity.of(group), null, 0, peak.date(), peak.rawCount(), null, 0, 0, 0, statisticsCalculator.calculate(group)
            );
        }

        Observation start = observations.get(startIdx);
        Observation end = observations.get(endIdx);
        return new RawNonZeroMetricsRecord(
            SeriesIdentity.of(group), start.date(), start.rawCount(), peak.date(), peak.rawCount(), end.date(), end.rawCount(),
            endIdx - startIdx, ChronoUnit.DAYS.between(start.date(), end.date()), statisticsCalculator.calculate(group)
        );
    }
}
