package edu.harvard.hms.dbmi.avillach.phenology.data.observation;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeriesGroupTest {

    private static final SeriesKey KEY = new SeriesKey("Minneapolis", "Fishing", 2024);

    private static Observation obs(String date, double count) {
        return Observation.of("Minneapolis", "Fishing", 2024, LocalDate.parse(date), count);
    }

    @Test
    void shouldSortByDayOfYear() {
        SeriesGroup group = new SeriesGroup(KEY, List.of(obs("2024-01-15", 3), obs("2024-01-01", 1), obs("2024-01-08", 2)));

        assertArrayEquals(new int[] {1, 8, 15}, group.days());
        assertArrayEquals(new double[] {1, 2, 3}, group.rawCounts());
        assertEquals(LocalDate.parse("2024-01-01"), group.first().orElseThrow().date());
    }

    @Test
    void shouldKeepInputOrderForDuplicateDays() {
        SeriesGroup group = new SeriesGroup(KEY, List.of(obs("2024-01-08", 7), obs("2024-01-01", 1), obs("2024-01-08", 5)));

        assertArrayEquals(new int[] {1, 8, 8}, group.days());
        assertArrayEquals(new double[] {1, 7, 5}, group.rawCounts());
    }

    @Test
    void shouldResolveLastObservedDate() {
        SeriesGroup group = new SeriesGroup(KEY, List.of(obs("2024-01-01", 1), obs("2024-01-08", 2), obs("2024-01-15", 3)));

        assertEquals(LocalDate.parse("2024-01-01"), group.lastObservedDateOnOrBefore(1).orElseThrow());
        assertEquals(LocalDate.parse("2024-01-01"), group.lastObservedDateOnOrBefore(7).orElseThrow());
        assertEquals(LocalDate.parse("2024-01-08"), group.lastObservedDateOnOrBefore(8).orElseThrow());
        assertEquals(LocalDate.parse("2024-01-15"), group.lastObservedDateOnOrBefore(200).orElseThrow());
        assertTrue(group.lastObservedDateOnOrBefore(0).isEmpty());
    }

    @Test
    void shouldRejectObservationFromAnotherSeries() {
        Observation other = Observation.of("Duluth", "Fishing", 2024, LocalDate.parse("2024-01-01"), 1);

        assertThrows(IllegalArgumentException.class, () -> new SeriesGroup(KEY, List.of(obs("2024-01-08", 1), other)));
    }

    @Test
    void emptyGroupHasNoFirstObservation() {
        SeriesGroup group = new SeriesGroup(KEY, List.of());

        assertTrue(group.isEmpty());
        assertTrue(group.first().isEmpty());
        assertEquals(0, group.days().length);
    }

    @Test
    void keysShouldOrderByLocationThenTermThenYear() {
        SeriesKey a = new SeriesKey("Austin", "Fishing", 2024);
        SeriesKey b = new SeriesKey("Austin", "Fly Fishing", 2023);
        SeriesKey c = new SeriesKey("Austin", "Fly Fishing", 2024);
        SeriesKey d = new SeriesKey("Boston", "Bass Fishing", 2020);

        assertTrue(a.compareTo(b) < 0);
        assertTrue(b.compareTo(c) < 0);
        assertTrue(c.compareTo(d) < 0);
        assertEquals(0, a.compareTo(new SeriesKey("Austin", "Fishing", 2024)));
    }

    @Test
    void shouldRejectNegativeCount() {
        assertThrows(IllegalArgumentException.class, () -> obs("2024-01-01", -1));
        assertThrows(IllegalArgumentException.class, () -> obs("2024-01-01", Double.NaN));
    }
}
