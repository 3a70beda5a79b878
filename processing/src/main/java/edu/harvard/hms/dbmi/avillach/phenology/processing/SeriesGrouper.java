package edu.harvard.hms.dbmi.avillach.phenology.processing;

import edu.harvard.hms.dbmi.avillach.phenology.data.observation.Observation;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesGroup;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesKey;
import edu.harvard.hms.dbmi.avillach.phenology.exception.InsufficientDataException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Partitions observations into one {@link SeriesGroup} per (location, search term, year).
 */
@Component
public class SeriesGrouper {

    /**
     * @return groups in {@link SeriesKey} order, each sorted by day of year with ties in input order
     */
    public List<SeriesGroup> group(Iterable<Observation> observations) {
        Map<SeriesKey, List<Observation>> byKey = new TreeMap<>();
        for (Observation observation : observations) {
            byKey.computeIfAbsent(observation.key(), k -> new ArrayList<>()).add(observation);
        }
        List<SeriesGroup> groups = new ArrayList<>(byKey.size());
        byKey.forEach((key, members) -> groups.add(new SeriesGroup(key, members)));
        return groups;
    }

    public void validate(SeriesGroup group) {
        if (group.isEmpty()) {
            throw new InsufficientDataException("Series " + group.getKey() + " has no observations");
        }
    }
}
