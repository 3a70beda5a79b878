package edu.harvard.hms.dbmi.avillach.phenology.processing.strategy;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.StrategyType;
import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.ThresholdMetricsRecord;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesGroup;
import edu.harvard.hms.dbmi.avillach.phenology.data.series.SeasonWindow;
import edu.harvard.hms.dbmi.avillach.phenology.processing.PhenologyParameters;
import edu.harvard.hms.dbmi.avillach.phenology.processing.SeriesFixtures;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SmoothedThresholdStrategyTest {

    private final SmoothedThresholdStrategy strategy = new SmoothedThresholdStrategy();

    private static PhenologyParameters parameters(double sigma, double pct) {
        return new PhenologyParameters(sigma, pct, StrategyType.SMOOTHED_THRESHOLD);
    }

    @Test
    void allZeroSeriesSpansItsObservedRange() {
        ThresholdMetricsRecord record = strategy.analyze(SeriesFixtures.group(SeriesFixtures.WEEKLY_DAYS, new double[5]), parameters(4, 20));
        SeasonWindow window = record.window();

        assertEquals(1, window.startDoy());
        assertEquals(1, window.peakDoy());
        assertEquals(29, window.endDoy());
        assertEquals(28, window.durationDays());
        assertEquals(0.0, window.threshold());
        assertEquals(0.0, window.peakValue());
        assertEquals(5, record.seasonWeeks());
        assertEquals(0.0, record.seasonTotalSearches());
        assertEquals(LocalDate.of(2024, 1, 29), record.endDate());
    }

    @Test
    void widestSigmaFlattensSeriesAndKeepsWindowInsideDomain() {
        ThresholdMetricsRecord record = strategy.analyze(
            SeriesFixtures.group(SeriesFixtures.WEEKLY_DAYS, new double[] {0, 3, 10, 4, 0}), parameters(PhenologyParameters.MAX_SIGMA, 20)
        );
        SeasonWindow window = record.window();

        assertEquals(119.0 / 29, window.peakValue(), 1e-6);
        assertEquals(window.peakValue(), window.threshold(), 1e-6);
        assertTrue(window.startDoy() >= 1);
        assertTrue(window.startDoy() <= window.peakDoy());
        assertTrue(window.peakDoy() <= window.endDoy());
        assertTrue(window.endDoy() <= 29);
        assertEquals(window.endDoy() - window.startDoy(), window.durationDays());
    }

    @Test
    void singleSpikeGivesNarrowSeasonAroundIt() {
        ThresholdMetricsRecord record = strategy.analyze(
            SeriesFixtures.group(SeriesFixtures.WEEKLY_DAYS, new double[] {0, 0, 20, 0, 0}), parameters(1, 20)
        );
        SeasonWindow window = record.window();

        assertEquals(10, window.startDoy());
        assertEquals(15, window.peakDoy());
        assertEquals(21, window.endDoy());
        assertEquals(11, window.durationDays());
        assertEquals(3.584, window.threshold(), 1e-3);
        assertEquals(17.921, window.peakValue(), 1e-3);
        assertTrue(window.startValue() > window.threshold());
        assertTrue(window.endValue() <= window.threshold());

        assertEquals(LocalDate.of(2024, 1, 8), record.startDate());
        assertEquals(LocalDate.of(2024, 1, 15), record.peakDate());
        assertEquals(LocalDate.of(2024, 1, 15), record.endDate());
        assertEquals(1, record.seasonWeeks());
        assertEquals(20.0, record.seasonTotalSearches());
        assertEquals(20.0, record.statistics().totalSearches());
    }

    @Test
    void singleObservationHasZeroDuration() {
        ThresholdMetricsRecord record = strategy.analyze(SeriesFixtures.group(new int[] {120}, new double[] {8}), parameters(4, 20));

        assertEquals(120, record.window().startDoy());
        assertEquals(120, record.window().endDoy());
        assertEquals(0, record.window().durationDays());
        assertEquals(8.0, record.window().threshold(), 1e-12);
        assertEquals(1, record.seasonWeeks());
    }

    @Test
    void summerSeasonIsFoundAroundItsPeak() {
        ThresholdMetricsRecord record = strategy.analyze(SeriesFixtures.summerSeason(), parameters(4, 20));
        SeasonWindow window = record.window();

        assertTrue(window.peakDoy() > 170 && window.peakDoy() < 195, "peak at " + window.peakDoy());
        assertTrue(window.startDoy() > 100 && window.startDoy() < window.peakDoy(), "start at " + window.startDoy());
        assertTrue(window.endDoy() > window.peakDoy() && window.endDoy() < 260, "end at " + window.endDoy());
        assertTrue(record.seasonWeeks() > 0);
        assertTrue(record.startDate().getDayOfYear() <= window.startDoy());
        assertEquals(2023, record.startDate().getYear());
    }

    @Test
    void higherThresholdNeverLengthensTheSeason() {
        SeriesGroup group = SeriesFixtures.summerSeason();
        for (double sigma : new double[] {2, 4}) {
            long previous = Long.MAX_VALUE;
            for (double pct : new double[] {10, 20, 30, 40, 50}) {
                long duration = strategy.analyze(group, parameters(sigma, pct)).window().durationDays();
                assertTrue(duration <= previous, "sigma " + sigma + " pct " + pct + ": " + duration + " > " + previous);
                previous = duration;
            }
        }
    }

    @Test
    void sameInputGivesSameRecord() {
        int[] days = new int[60];
        double[] counts = new double[60];
        for (int i = 0; i < days.length; i++) {
            days[i] = 100 + i;
            counts[i] = Math.max(0, 30 - Math.abs(i - 25));
        }
        SeriesGroup group = SeriesFixtures.group(days, counts);

        assertEquals(strategy.analyze(group, parameters(3, 25)), strategy.analyze(group, parameters(3, 25)));
    }

    @Test
    void arbitrarySeriesProduceOrderedWindows() {
        Random random = new Random(20240101L);
        for (int trial = 0; trial < 200; trial++) {
            int size = 1 + random.nextInt(53);
            int[] days = random.ints(size, 1, 366).sorted().toArray();
            double[] counts = random.doubles(size, 0, 100).map(Math::floor).toArray();
            if (random.nextBoolean()) {
                Arrays.fill(counts, 0, size / 2, 0);
            }

            ThresholdMetricsRecord record = strategy.analyze(SeriesFixtures.group("Duluth", "Ice", 2023, days, counts), parameters(4, 20));
            SeasonWindow window = record.window();

            assertTrue(window.startDoy() <= window.peakDoy() && window.peakDoy() <= window.endDoy());
            assertTrue(window.startDoy() >= days[0] && window.endDoy() <= days[size - 1]);
            assertTrue(window.durationDays() >= 0);
            assertNotNull(record.startDate());
            assertNotNull(record.endDate());
        }
    }

    @Test
    void reportsItsType() {
        assertEquals(StrategyType.SMOOTHED_THRESHOLD, strategy.type());
    }
}
