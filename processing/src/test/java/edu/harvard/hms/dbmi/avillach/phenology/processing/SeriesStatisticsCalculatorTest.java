package edu.harvard.hms.dbmi.avillach.phenology.processing;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.SeriesStatistics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeriesStatisticsCalculatorTest {

    private final SeriesStatisticsCalculator calculator = new SeriesStatisticsCalculator();

    @Test
    void medianCrossingsCountTransitionsAroundTheMedian() {
        double[] values = {1, 1, 5, 5, 1, 1};
        double median = SeriesStatisticsCalculator.median(values);

        assertEquals(1.0, median);
        assertEquals(2, SeriesStatisticsCalculator.medianCrossings(values, median));
    }

    @Test
    void valuesEqualToTheMedianCountAsBelowIt() {
        double[] values = {0, 0, 0, 5};
        double median = SeriesStatisticsCalculator.median(values);

        assertEquals(0.0, median);
        assertEquals(1, SeriesStatisticsCalculator.medianCrossings(values, median));
        assertEquals(0, SeriesStatisticsCalculator.medianCrossings(new double[] {2, 2, 2}, 2));
    }

    @Test
    void medianOfEvenSampleIsMeanOfMiddleValues() {
        assertEquals(2.5, SeriesStatisticsCalculator.median(new double[] {4, 1, 3, 2}));
        assertEquals(3.0, SeriesStatisticsCalculator.median(new double[] {0, 10, 3, 4, 0}));
        assertEquals(0.0, SeriesStatisticsCalculator.median(new double[0]));
    }

    @Test
    void shouldSummariseRawSeries() {
        SeriesStatistics stats = calculator.calculate(SeriesFixtures.group(SeriesFixtures.WEEKLY_DAYS, new double[] {0, 3, 10, 4, 0}));

        assertEquals(17.0, stats.totalSearches());
        assertEquals(3, stats.numActiveWeeks());
        assertEquals(5, stats.totalWeeks());
        assertEquals(3.0, stats.medianAllWeeks());
        assertEquals(4.0, stats.medianActiveWeeks());
        assertEquals(2, stats.medianCrossings());
        assertEquals(17 / 3.0, stats.avgCountActiveWeeks(), 1e-12);
        assertEquals(3.0, stats.minCountActiveWeeks());
        assertEquals(10.0, stats.maxCountActiveWeeks());
    }

    @Test
    void allZeroSeriesHasZeroActiveStatistics() {
        SeriesStatistics stats = calculator.calculate(SeriesFixtures.group(SeriesFixtures.WEEKLY_DAYS, new double[5]));

        assertEquals(0.0, stats.totalSearches());
        assertEquals(0, stats.numActiveWeeks());
        assertEquals(5, stats.totalWeeks());
        assertEquals(0.0, stats.medianAllWeeks());
        assertEquals(0.0, stats.medianActiveWeeks());
        assertEquals(0, stats.medianCrossings());
        assertEquals(0.0, stats.avgCountActiveWeeks());
        assertEquals(0.0, stats.minCountActiveWeeks());
        assertEquals(0.0, stats.maxCountActiveWeeks());
    }
}
