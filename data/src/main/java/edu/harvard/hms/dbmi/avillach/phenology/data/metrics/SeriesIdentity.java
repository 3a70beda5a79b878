package edu.harvard.hms.dbmi.avillach.phenology.data.metrics;

import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesGroup;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesKey;

import java.util.List;
import java.util.Map;

/**
 * Identity and location metadata of an output record. Metadata comes from the group's first observation.
 */
public record SeriesIdentity(
    String location,
    Double latitude,
    Double longitude,
    String geoCode,
    String state,
    String country,
    String searchTerm,
    int year
) {

    static final List<String> COLUMNS =
        List.of("location", "latitude", "longitude", "geo_code", "state", "country", "search_term", "year");

    public static SeriesIdentity of(SeriesGroup group) {
        SeriesKey key = group.getKey();
        return group.first()
            .map(o -> new SeriesIdentity(
                key.location(), o.latitude(), o.longitude(), o.geoCode(), o.state(), o.country(), key.searchTerm(), key.year()
            ))
            .orElseGet(() -> new SeriesIdentity(key.location(), null, null, null, null, null, key.searchTerm(), key.year()));
    }

    void putColumns(Map<String, Object> columns) {
        columns.put("location", location);
        columns.put("latitude", latitude);
        columns.put("longitude", longitude);
        columns.put("geo_code", geoCode);
        columns.put("state", state);
        columns.put("country", country);
        columns.put("search_term", searchTerm);
        columns.put("year", year);
    }
}
