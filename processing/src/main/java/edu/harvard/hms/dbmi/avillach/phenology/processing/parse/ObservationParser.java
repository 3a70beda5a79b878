package edu.harvard.hms.dbmi.avillach.phenology.processing.parse;

import edu.harvard.hms.dbmi.avillach.phenology.data.observation.Observation;
import edu.harvard.hms.dbmi.avillach.phenology.exception.MalformedObservationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Turns a long-format input row into an {@link Observation}.
 *
 * Required columns: date, location, search_term, search_count. Optional: year (taken from the date when blank),
 * geo_code, state, country, latitude, longitude.
 *
 * A blank or non-numeric search count is read as 0, the way the upstream export tooling coerces it. A negative or
 * infinite count, a missing identity column or an unparseable date rejects the row.
 */
@Component
public class ObservationParser {

    private static final Logger log = LoggerFactory.getLogger(ObservationParser.class);

    public static final String DATE = "date";
    public static final String LOCATION = "location";
    public static final String SEARCH_TERM = "search_term";
    public static final String YEAR = "year";
    public static final String GEO_CODE = "geo_code";
    public static final String STATE = "state";
    public static final String COUNTRY = "country";
    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";
    public static final String SEARCH_COUNT = "search_count";

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Pattern INFINITY = Pattern.compile("[+-]?inf(inity)?", Pattern.CASE_INSENSITIVE);

    private final NullSentinelDetector nullSentinelDetector = new NullSentinelDetector();

    public ParsedRow parse(InputRow row) throws MalformedObservationException {
        String location = requiredText(row, LOCATION);
        String searchTerm = requiredText(row, SEARCH_TERM);
        LocalDate date = parseDate(row.get(DATE));
        int year = parseYear(row.get(YEAR), date);

        String countRaw = row.get(SEARCH_COUNT);
        double count;
        boolean coerced = false;
        if (nullSentinelDetector.isNullSentinel(countRaw)) {
            count = 0;
            coerced = true;
        } else if (isDecimal(countRaw)) {
            count = Double.parseDouble(countRaw.trim());
        } else if (INFINITY.matcher(countRaw.trim()).matches()) {
            count = Double.POSITIVE_INFINITY;
        } else {
            log.debug("Row {}: search_count '{}' is not numeric, reading as 0", row.rowNumber(), countRaw);
            count = 0;
            coerced = true;
        }
        if (Double.isInfinite(count) || count < 0) {
            throw new MalformedObservationException(SEARCH_COUNT, countRaw, "Search count must be a finite non-negative number");
        }

        Observation observation = new Observation(
            location, searchTerm, year, date, date.getDayOfYear(), count, optionalText(row, GEO_CODE), optionalText(row, STATE),
            optionalText(row, COUNTRY), optionalNumber(row, LATITUDE), optionalNumber(row, LONGITUDE)
        );
        return new ParsedRow(observation, coerced);
    }

    private String requiredText(InputRow row, String column) throws MalformedObservationException {
        String value = row.get(column);
        if (nullSentinelDetector.isNullSentinel(value)) {
            throw new MalformedObservationException(column, value, "Required column " + column + " is missing or empty");
        }
        return value.trim();
    }

    private String optionalText(InputRow row, String column) {
        String value = row.get(column);
        return nullSentinelDetector.isNullSentinel(value) ? null : value.trim();
    }

    private Double optionalNumber(InputRow row, String column) {
        String value = row.get(column);
        if (nullSentinelDetector.isNullSentinel(value)) {
            return null;
        }
        if (!isDecimal(value)) {
            log.debug("Row {}: {} '{}' is not numeric, leaving it empty", row.rowNumber(), column, value);
            return null;
        }
        return Double.valueOf(value.trim());
    }

    /**
     * Plain decimal or scientific notation only. Java literal forms such as {@code 1d}, {@code 2f} or hex floats
     * are not numbers in the input.
     */
    static boolean isDecimal(String value) {
        return DECIMAL.matcher(value.trim()).matches();
    }

    /**
     * Accepts {@code yyyy-MM-dd}, optionally followed by a time part separated by 'T' or a space.
     */
    static LocalDate parseDate(String raw) throws MalformedObservationException {
        if (raw == null || raw.isBlank()) {
            throw new MalformedObservationException(DATE, raw, "Date is missing");
        }
        String value = raw.trim();
        if (value.length() > 10 && (value.charAt(10) == 'T' || value.charAt(10) == ' ')) {
            value = value.substring(0, 10);
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new MalformedObservationException(DATE, raw, "Unparseable date: " + raw, e);
        }
    }

    private int parseYear(String raw, LocalDate date) throws MalformedObservationException {
        if (nullSentinelDetector.isNullSentinel(raw)) {
            return date.getYear();
        }
        String value = raw.trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            // float-typed exports write 2024.0
            if (value.matches("\\d{1,4}\\.0+")) {
                return Integer.parseInt(value.substring(0, value.indexOf('.')));
            }
            throw new MalformedObservationException(YEAR, raw, "Year is not an integer: " + raw, e);
        }
    }
}
