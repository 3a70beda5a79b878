package edu.harvard.hms.dbmi.avillach.phenology.data.observation;

import com.google.common.collect.ComparisonChain;

import java.util.Objects;

/**
 * Identifies one analysed series. Ordered by location, then search term, then year so that batches are
 * reproducible.
 */
public record SeriesKey(String location, String searchTerm, int year) implements Comparable<SeriesKey> {

    public SeriesKey {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(searchTerm, "searchTerm");
    }

    @Override
    public int compareTo(SeriesKey o) {
        return ComparisonChain.start()
            .compare(location, o.location)
            .compare(searchTerm, o.searchTerm)
            .compare(year, o.year)
            .result();
    }

    @Override
    public String toString() {
        return location + "/" + searchTerm + "/" + year;
    }
}
