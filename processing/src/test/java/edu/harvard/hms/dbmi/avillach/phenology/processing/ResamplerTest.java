package edu.harvard.hms.dbmi.avillach.phenology.processing;

import edu.harvard.hms.dbmi.avillach.phenology.data.series.ContinuousSeries;
import edu.harvard.hms.dbmi.avillach.phenology.exception.InsufficientDataException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResamplerTest {

    private final Resampler resampler = new Resampler();

    @Test
    void shouldInterpolateEveryDayBetweenObservations() {
        ContinuousSeries series = resampler.resample(new int[] {1, 8, 15}, new double[] {0, 7, 14});

        assertEquals(1, series.getFirstDay());
        assertEquals(15, series.getLastDay());
        for (int i = 0; i < series.size(); i++) {
            assertEquals(i, series.valueAt(i), 1e-12);
        }
    }

    @Test
    void shouldHandleUnevenGaps() {
        ContinuousSeries series = resampler.resample(new int[] {10, 12, 22}, new double[] {4, 8, 3});

        assertEquals(13, series.size());
        assertEquals(6.0, series.valueAt(1), 1e-12);
        assertEquals(8.0, series.valueAt(2), 1e-12);
        assertEquals(5.5, series.valueAt(7), 1e-12);
        assertEquals(3.0, series.valueAt(12), 1e-12);
    }

    @Test
    void singleObservationGivesSingleDay() {
        ContinuousSeries series = resampler.resample(SeriesFixtures.group(new int[] {100}, new double[] {5}));

        assertEquals(1, series.size());
        assertEquals(100, series.getFirstDay());
        assertEquals(5.0, series.valueAt(0));
    }

    @Test
    void duplicateDaysUseFirstSampleAndDoNotCrash() {
        ContinuousSeries series = resampler.resample(new int[] {1, 8, 8, 15}, new double[] {0, 7, 3, 14});

        assertEquals(15, series.size());
        assertEquals(6.0, series.valueAt(6), 1e-12);
        assertEquals(7.0, series.valueAt(7), 1e-12);
        assertEquals(3 + 11.0 / 7, series.valueAt(8), 1e-12);
        assertEquals(14.0, series.valueAt(14), 1e-12);
    }

    @Test
    void shouldExtrapolateAlongNearestSegment() {
        int[] days = {5, 10};
        double[] counts = {10, 20};

        assertEquals(0.0, Resampler.interpolate(days, counts, 0), 1e-12);
        assertEquals(30.0, Resampler.interpolate(days, counts, 15), 1e-12);
        assertEquals(7.0, Resampler.interpolate(new int[] {3}, new double[] {7}, 9), 1e-12);
    }

    @Test
    void alreadyDailySeriesIsUnchanged() {
        int[] days = new int[30];
        double[] counts = new double[30];
        for (int i = 0; i < days.length; i++) {
            days[i] = 40 + i;
            counts[i] = (i * 37) % 11;
        }

        assertArrayEquals(counts, resampler.resample(days, counts).getValues());
    }

    @Test
    void emptySeriesIsInsufficientData() {
        assertThrows(InsufficientDataException.class, () -> resampler.resample(new int[0], new double[0]));
        assertThrows(InsufficientDataException.class, () -> resampler.resample(SeriesFixtures.group(new int[0], new double[0])));
    }

    @Test
    void shouldRejectUnsortedDays() {
        assertThrows(IllegalArgumentException.class, () -> resampler.resample(new int[] {8, 1}, new double[] {1, 2}));
    }
}
