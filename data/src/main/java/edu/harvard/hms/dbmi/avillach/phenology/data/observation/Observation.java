package edu.harvard.hms.dbmi.avillach.phenology.data.observation;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One weekly search-interest sample for a location and search term.
 *
 * The identity columns and the count are what the engine works on. geoCode, state, country, latitude and longitude
 * are carried through untouched into the output record and may be null.
 */
public record Observation(
    String location,
    String searchTerm,
    int year,
    LocalDate date,
    int dayOfYear,
    double rawCount,
    String geoCode,
    String state,
    String country,
    Double latitude,
    Double longitude
) {

    public Observation {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(searchTerm, "searchTerm");
        Objects.requireNonNull(date, "date");
        if (dayOfYear < 1 || dayOfYear > 366) {
            throw new IllegalArgumentException("dayOfYear out of range: " + dayOfYear);
        }
        if (!(rawCount >= 0) || Double.isInfinite(rawCount)) {
            throw new IllegalArgumentException("rawCount must be a finite non-negative number, was " + rawCount);
        }
    }

    /**
     * Builds an observation without location metadata, deriving the day of year from the date.
     */
    public static Observation of(String location, String searchTerm, int year, LocalDate date, double rawCount) {
        return new Observation(location, searchTerm, year, date, date.getDayOfYear(), rawCount, null, null, null, null, null);
    }

    public SeriesKey key() {
        return new SeriesKey(location, searchTerm, year);
    }

    /**
     * An active week is one with a strictly positive count.
     */
    public boolean isActive() {
        return rawCount > 0;
    }
}
