package edu.harvard.hms.dbmi.avillach.phenology.service.producer;

import edu.harvard.hms.dbmi.avillach.phenology.processing.parse.InputRow;
import edu.harvard.hms.dbmi.avillach.phenology.processing.parse.ObservationParser;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Streams rows of a long-format search interest CSV.
 *
 * The first line must be a header. Header names are matched case-insensitively and may appear in any order; columns
 * the parser does not know are ignored. Required headers:
 *   date, location, search_term, search_count
 *
 * Optional headers:
 *   year, geo_code, state, country, latitude, longitude
 *
 * A record with fewer cells than the header is passed on with the missing cells absent, so the row is judged by
 * the observation parser rather than dropped here.
 */
public class CsvObservationProducer {
    private static final Logger log = LoggerFactory.getLogger(CsvObservationProducer.class);

    static final List<String> REQUIRED_HEADERS = List.of(
        ObservationParser.DATE, ObservationParser.LOCATION, ObservationParser.SEARCH_TERM, ObservationParser.SEARCH_COUNT
    );

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT
        .builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setAllowMissingColumnNames(true)
        .setTrim(true)
        .setQuote('"')
        .build();

    /**
     * Processes a single CSV file with streaming parser.
     *
     * @param filePath path to CSV file
     * @param consumer callback for each batch
     * @param batchSize rows per batch
     * @return number of data rows read
     * @throws IOException if the file cannot be read or its header lacks a required column
     */
    public long processFile(Path filePath, Consumer<List<InputRow>> consumer, int batchSize) throws IOException {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, was " + batchSize);
        }
        log.info("Processing CSV file: {}", filePath);

        try (BufferedReader reader = Files.newBufferedReader(filePath);
             CSVParser parser = new CSVParser(reader, FORMAT)) {
            Map<String, Integer> columns = normalizeHeader(parser.getHeaderMap(), filePath);

            List<InputRow> batch = new ArrayList<>(batchSize);
            long rows = 0;
            for (CSVRecord record : parser) {
                rows++;
                batch.add(toRow(rows, record, columns));
                if (batch.size() >= batchSize) {
                    consumer.accept(new ArrayList<>(batch));
                    batch.clear();
                }
            }

            // Flush remaining
            if (!batch.isEmpty()) {
                consumer.accept(batch);
            }

            log.info("Completed processing CSV file: {} ({} rows)", filePath, rows);
            return rows;
        }
    }

    /**
     * Lowercased header name to cell index. Names differing only in case resolve to the leftmost column.
     */
    private Map<String, Integer> normalizeHeader(Map<String, Integer> headerMap, Path filePath) throws IOException {
        if (headerMap == null || headerMap.isEmpty()) {
            throw new IOException("CSV file has no header row: " + filePath);
        }
        Map<String, Integer> columns = new HashMap<>();
        for (Map.Entry<String, Integer> header : headerMap.entrySet()) {
            String name = header.getKey();
            if (name != null && !name.isBlank()) {
                columns.merge(name.trim().toLowerCase(Locale.ROOT), header.getValue(), Math::min);
            }
        }

        List<String> missing = new ArrayList<>();
        for (String required : REQUIRED_HEADERS) {
            if (!columns.containsKey(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new IOException("CSV file " + filePath + " is missing required columns " + missing + ", found " + headerMap.keySet());
        }
        log.debug("Header of {}: {}", filePath.getFileName(), columns.keySet());
        return columns;
    }

    /**
     * @param rowNumber 1-based data row number, the header not counted
     */
    private static InputRow toRow(long rowNumber, CSVRecord record, Map<String, Integer> columns) {
        Map<String, String> values = new HashMap<>();
        for (Map.Entry<String, Integer> column : columns.entrySet()) {
            int index = column.getValue();
            if (index < record.size()) {
                values.put(column.getKey(), record.get(index));
            }
        }
        return new InputRow(rowNumber, values);
    }
}
