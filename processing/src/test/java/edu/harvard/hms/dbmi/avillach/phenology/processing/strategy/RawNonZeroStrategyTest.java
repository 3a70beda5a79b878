package edu.harvard.hms.dbmi.avillach.phenology.processing.strategy;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.RawNonZeroMetricsRecord;
import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.StrategyType;
import edu.harvard.hms.dbmi.avillach.phenology.processing.PhenologyParameters;
import edu.harvard.hms.dbmi.avillach.phenology.processing.SeriesFixtures;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class RawNonZeroStrategyTest {

    private final RawNonZeroStrategy strategy = new RawNonZeroStrategy();

    private final PhenologyParameters parameters = new PhenologyParameters(4, 20, StrategyType.RAW_NONZERO);

    @Test
    void seasonRunsFromFirstToLastActiveWeek() {
        RawNonZeroMetricsRecord record = strategy.analyze(
            SeriesFixtures.group(SeriesFixtures.WEEKLY_DAYS, new double[] {0, 3, 10, 4, 0}), parameters
        );

        assertEquals(LocalDate.of(2024, 1, 8), record.seasonStartDate());
        assertEquals(3.0, record.seasonStartCount());
        assertEquals(LocalDate.of(2024, 1, 15), record.peakDate());
        assertEquals(10.0, record.peakCount());
        assertEquals(LocalDate.of(2024, 1, 22), record.seasonEndDate());
        assertEquals(4.0, record.seasonEndCount());
        assertEquals(2, record.durationWeeks());
        assertEquals(14, record.durationDays());
        assertEquals(3, record.statistics().numActiveWeeks());
    }

    @Test
    void allZeroSeriesHasNoSeason() {
        RawNonZeroMetricsRecord record = strategy.analyze(SeriesFixtures.group(SeriesFixtures.WEEKLY_DAYS, new double[5]), parameters);

        assertNull(record.seasonStartDate());
        assertNull(record.seasonEndDate());
        assertEquals(0.0, record.seasonStartCount());
        assertEquals(0.0, record.seasonEndCount());
        assertEquals(LocalDate.of(2024, 1, 1), record.peakDate());
        assertEquals(0.0, record.peakCount());
        assertEquals(0, record.durationWeeks());
        assertEquals(0, record.durationDays());
    }

    @Test
    void earliestMaximumIsThePeak() {
        RawNonZeroMetricsRecord record = strategy.analyze(
            SeriesFixtures.group(SeriesFixtures.WEEKLY_DAYS, new double[] {2, 9, 1, 9, 0}), parameters
        );

        assertEquals(LocalDate.of(2024, 1, 8), record.peakDate());
        assertEquals(LocalDate.of(2024, 1, 1), record.seasonStartDate());
        assertEquals(LocalDate.of(2024, 1, 22), record.seasonEndDate());
        assertEquals(3, record.durationWeeks());
    }

    @Test
    void singleActiveWeekIsZeroLength() {
        RawNonZeroMetricsRecord record = strategy.analyze(
            SeriesFixtures.group(SeriesFixtures.WEEKLY_DAYS, new double[] {0, 0, 5, 0, 0}), parameters
        );

        assertEquals(record.seasonStartDate(), record.seasonEndDate());
        assertEquals(record.peakDate(), record.seasonStartDate());
        assertEquals(0, record.durationWeeks());
        assertEquals(0, record.durationDays());
    }
}
