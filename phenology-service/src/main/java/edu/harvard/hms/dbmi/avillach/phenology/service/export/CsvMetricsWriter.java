package edu.harvard.hms.dbmi.avillach.phenology.service.export;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.MetricsRecord;
import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.StrategyType;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Writes metrics records of one strategy as CSV, one header row then one row per series.
 *
 * Cell rendering: dates as yyyy-MM-dd, absent dates as {@value #MISSING_DATE}, other absent values as an empty cell,
 * floating point values in plain notation.
 */
public class CsvMetricsWriter implements MetricsWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvMetricsWriter.class);

    static final String MISSING_DATE = "N/A";

    private final Path file;

    private final StrategyType strategy;

    private final List<String> columns;

    private final CSVPrinter printer;

    private long recordsWritten;

    public CsvMetricsWriter(Path file, StrategyType strategy) throws IOException {
        this.file = file;
        this.strategy = strategy;
        this.columns = strategy.columnNames();
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.printer = new CSVPrinter(Files.newBufferedWriter(file), CSVFormat.DEFAULT.builder().setRecordSeparator('\n').build());
    }

    @Override
    public void writeHeader() throws IOException {
        printer.printRecord(columns);
    }

    @Override
    public void writeRecords(Collection<? extends MetricsRecord> records) throws IOException {
        for (MetricsRecord record : records) {
            if (record.strategy() != strategy) {
                throw new IllegalArgumentException(
                    "Cannot write " + record.strategy().getLabel() + " record to " + strategy.getLabel() + " output " + file
                );
            }
            Map<String, Object> values = record.columns();
            List<String> cells = new ArrayList<>(columns.size());
            for (String column : columns) {
                cells.add(render(column, values.get(column)));
            }
            printer.printRecord(cells);
            recordsWritten++;
        }
    }

    static String render(String column, Object value) {
        if (value == null) {
            return column.endsWith("_date") ? MISSING_DATE : "";
        }
        if (value instanceof LocalDate date) {
            return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                return "";
            }
            String text = Double.toString(d);
            return text.indexOf('E') < 0 ? text : BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    @Override
    public long getRecordsWritten() {
        return recordsWritten;
    }

    @Override
    public Path getFile() {
        return file;
    }

    @Override
    public void close() throws IOException {
        printer.close(true);
        log.info("Wrote {} {} records to {}", recordsWritten, strategy.getLabel(), file);
    }
}
