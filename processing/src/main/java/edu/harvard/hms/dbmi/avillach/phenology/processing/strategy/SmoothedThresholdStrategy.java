package edu.harvard.hms.dbmi.avillach.phenology.processing.strategy;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.SeriesIdentity;
import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.StrategyType;
import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.ThresholdMetricsRecord;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.Observation;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesGroup;
import edu.harvard.hms.dbmi.avillach.phenology.data.series.ContinuousSeries;
import edu.harvard.hms.dbmi.avillach.phenology.data.series.SeasonWindow;
import edu.harvard.hms.dbmi.avillach.phenology.data.series.SmoothedSeries;
import edu.harvard.hms.dbmi.avillach.phenology.exception.InsufficientDataException;
import edu.harvard.hms.dbmi.avillach.phenology.processing.BoundaryDetector;
import edu.harvard.hms.dbmi.avillach.phenology.processing.GaussianSmoother;
import edu.harvard.hms.dbmi.avillach.phenology.processing.PhenologyParameters;
import edu.harvard.hms.dbmi.avillach.phenology.processing.Resampler;
import edu.harvard.hms.dbmi.avillach.phenology.processing.SeriesStatisticsCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Resample to daily values, smooth, and detect the season against a threshold relative to the smoothed range.
 * Boundary values are smoothed estimates. Boundary dates are the last observed dates on or before each boundary.
 */
@Component
public class SmoothedThresholdStrategy implements PhenologyStrategy {

    private static final Logger log = LoggerFactory.getLogger(SmoothedThresholdStrategy.class);

    private final Resampler resampler;

    private final GaussianSmoother smoother;

    private final BoundaryDetector boundaryDetector;

    private final SeriesStatisticsCalculator statisticsCalculator;

    @Autowired
    public SmoothedThresholdStrategy(
        Resampler resampler, GaussianSmoother smoother, BoundaryDetector boundaryDetector, SeriesStatisticsCalculator statisticsCalculator
    ) {
        this.resampler = resampler;
        this.smoother = smoother;
        this.boundaryDetector = boundaryDetector;
        this.statisticsCalculator = statisticsCalculator;
    }

    public SmoothedThresholdStrategy() {
        this(new Resampler(), new GaussianSmoother(), new BoundaryDetector(), new SeriesStatisticsCalculator());
    }

    @Override
    public StrategyType type() {
        return StrategyType.SMOOTHED_THRESHOLD;
    }

    @Override
    public ThresholdMetricsRecord analyze(SeriesGroup group, PhenologyParameters parameters) {
        ContinuousSeries continuous = resampler.resample(group);
        SmoothedSeries smoothed = smoother.smooth(continuous, parameters.sigma());
        SeasonWindow window = boundaryDetector.detect(smoothed, parameters.thresholdPct());

        int seasonWeeks = 0;
        double seasonTotal = 0;
        for (Observation observation : group.getObservations()) {
            if (window.days().contains(observation.dayOfYear())) {
                seasonWeeks++;
                seasonTotal += observation.rawCount();
            }
        }

        log.debug(
            "{}: start={} peak={} end={} threshold={}", group.getKey(), window.startDoy(), window.peakDoy(), window.endDoy(),
            window.threshold()
        );

        return new ThresholdMetricsRecord(
            SeriesIdentity.of(group), parameters.sigma(), parameters.thresholdPct(), window, observedDate(group, window.startDoy()),
            observedDate(group, window.peakDoy()), observedDate(group, window.endDoy()), seasonWeeks, seasonTotal,
            statisticsCalculator.calculate(group)
        );
    }

    private static LocalDate observedDate(SeriesGroup group, int day) {
        return group.lastObservedDateOnOrBefore(day)
            .orElseThrow(() -> new InsufficientDataException("Series " + group.getKey() + " has no observation on or before day " + day));
    }
}
