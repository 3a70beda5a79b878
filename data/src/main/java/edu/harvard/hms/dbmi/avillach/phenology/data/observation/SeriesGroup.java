package edu.harvard.hms.dbmi.avillach.phenology.data.observation;

import com.google.common.collect.ImmutableList;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * All observations of one {@link SeriesKey}, ordered by day of year.
 *
 * The sort is stable, so observations that share a day of year keep their input order. Duplicates are kept as they
 * are; removing them is up to whoever produced the rows.
 */
public class SeriesGroup {

	private final SeriesKey key;

	private final ImmutableList<Observation> observations;

	public SeriesGroup(SeriesKey key, List<Observation> observations) {
		this.key = key;
		this.observations = ImmutableList.sortedCopyOf(Comparator.comparingInt(Observation::dayOfYear), observations);
		for (Observation observation : this.observations) {
			if (!key.equals(observation.key())) {
				throw new IllegalArgumentException("Observation for " + observation.key() + " does not belong to group " + key);
			}
		}
	}

	public SeriesKey getKey() {
		return key;
	}

	public ImmutableList<Observation> getObservations() {
		return observations;
	}

	public int size() {
		return observations.size();
	}

	public boolean isEmpty() {
		return observations.isEmpty();
	}

	public int[] days() {
		return observations.stream().mapToInt(Observation::dayOfYear).toArray();
	}

	public double[] rawCounts() {
		return observations.stream().mapToDouble(Observation::rawCount).toArray();
	}

	/**
	 * The first observation in day order, used for the location metadata of the output record.
	 */
	public Optional<Observation> first() {
		return observations.isEmpty() ? Optional.empty() : Optional.of(observations.get(0));
	}

	/**
	 * Date of the last observation whose day of year is on or before {@code day}. Reported boundary dates are always
	 * real observed dates, never interpolated ones.
	 */
	public Optional<LocalDate> lastObservedDateOnOrBefore(int day) {
		LocalDate found = null;
		for (Observation observation : observations) {
			if (observation.dayOfYear() > day) {
				break;
			}
			found = observation.date();
		}
		return Optional.ofNullable(found);
	}
}
