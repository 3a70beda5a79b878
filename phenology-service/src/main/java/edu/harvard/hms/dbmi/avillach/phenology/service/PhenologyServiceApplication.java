package edu.harvard.hms.dbmi.avillach.phenology.service;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.StrategyType;
import edu.harvard.hms.dbmi.avillach.phenology.processing.BatchResult;
import edu.harvard.hms.dbmi.avillach.phenology.processing.ParsedObservations;
import edu.harvard.hms.dbmi.avillach.phenology.processing.PhenologyParameters;
import edu.harvard.hms.dbmi.avillach.phenology.processing.PhenologyProcessor;
import edu.harvard.hms.dbmi.avillach.phenology.processing.ProcessingFailure;
import edu.harvard.hms.dbmi.avillach.phenology.processing.SeriesGrouper;
import edu.harvard.hms.dbmi.avillach.phenology.processing.parse.ObservationParser;
import edu.harvard.hms.dbmi.avillach.phenology.processing.strategy.PhenologyStrategy;
import edu.harvard.hms.dbmi.avillach.phenology.service.config.PhenologyConfig;
import edu.harvard.hms.dbmi.avillach.phenology.service.export.CsvMetricsWriter;
import edu.harvard.hms.dbmi.avillach.phenology.service.export.MetricsWriter;
import edu.harvard.hms.dbmi.avillach.phenology.service.failure.FailureReason;
import edu.harvard.hms.dbmi.avillach.phenology.service.failure.FailureRecord;
import edu.harvard.hms.dbmi.avillach.phenology.service.failure.FailureSink;
import edu.harvard.hms.dbmi.avillach.phenology.service.producer.CsvObservationProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Search interest phenology service.
 *
 * Orchestrates:
 * - CSV observation ingestion
 * - Per-series season detection with the configured strategy
 * - Metrics CSV export
 * - Failure tracking
 *
 * Run with:
 * java -jar phenology-service.jar \
 *   --phenology.input-file=/path/to/search_interest.csv \
 *   --phenology.strategy=smoothed-threshold \
 *   --phenology.sigma=4 \
 *   --phenology.threshold-pct=20
 */
@SpringBootApplication(scanBasePackages = "edu.harvard.hms.dbmi.avillach.phenology")
@ConfigurationPropertiesScan("edu.harvard.hms.dbmi.avillach.phenology.service.config")
public class PhenologyServiceApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(PhenologyServiceApplication.class);

    private final PhenologyConfig config;

    private final PhenologyProcessor processor;

    public PhenologyServiceApplication(PhenologyConfig config, PhenologyProcessor processor) {
        this.config = config;
        this.processor = processor;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(PhenologyServiceApplication.class);
        app.run(args);
    }

    @Bean
    static PhenologyProcessor phenologyProcessor(ObservationParser parser, SeriesGrouper grouper,
                                                 List<PhenologyStrategy> strategies, PhenologyConfig config) {
        return new PhenologyProcessor(parser, grouper, strategies, config.getThreads());
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting search interest phenology analysis");
        String runId = UUID.randomUUID().toString();
        log.info("Run ID: {}", runId);

        BatchResult result = analyze(runId);
        if (!result.isSuccess()) {
            log.warn("Run {} finished with {} failures, see {}", runId, result.getFailures().size(), config.getFailureFile());
        }
    }

    /**
     * Reads the input file, analyses every series and writes the metrics and failure files.
     */
    BatchResult analyze(String runId) throws IOException {
        Instant startTime = Instant.now();
        PhenologyParameters parameters = config.toParameters();
        StrategyType strategy = parameters.strategy();
        Path inputFile = Path.of(config.getInputFile());

        try (FailureSink failureSink = new FailureSink(Path.of(config.getFailureFile()))) {
            ParsedObservations parsed = new ParsedObservations();
            try {
                new CsvObservationProducer().processFile(inputFile, batch -> processor.parse(batch, parsed), config.getBatchSize());
            } catch (IOException e) {
                log.error("Unable to read input file {}", inputFile, e);
                failureSink.recordFailure(new FailureRecord(
                    runId, inputFile.toString(), strategy.getLabel(), null, null, null, null, null, null,
                    FailureReason.FILE_READ_ERROR, e.getMessage()
                ));
                throw e;
            }

            BatchResult result = processor.analyze(parsed, parameters);
            for (ProcessingFailure failure : result.getFailures()) {
                failureSink.recordFailure(FailureRecord.of(runId, inputFile.toString(), strategy.getLabel(), failure));
            }

            try (MetricsWriter writer = new CsvMetricsWriter(Path.of(config.getOutputFile()), strategy)) {
                writer.writeHeader();
                writer.writeRecords(result.getRecords());
            }

            long durationSeconds = Duration.between(startTime, Instant.now()).toSeconds();
            int groups = result.getGroupsSucceeded() + result.getGroupsFailed();
            if (result.getRowsRead() > 0 && result.getGroupsSucceeded() == 0) {
                log.error("=== ANALYSIS COMPLETE (BUT WITH ZERO SERIES ANALYSED) ===");
                log.error("This usually indicates an input problem:");
                log.error("  - Column names may not match the expected header");
                log.error("  - Dates may not be in yyyy-MM-dd format");
            } else {
                log.info("=== ANALYSIS COMPLETE ===");
            }

            log.info("Run ID: {}", runId);
            log.info("Strategy: {}", strategy.getLabel());
            log.info("Rows read: {}", result.getRowsRead());
            log.info("Rows rejected: {}", result.getRowsRejected());
            log.info("Counts read as zero: {}", result.getCountsCoerced());
            log.info("Series analysed: {} of {}", result.getGroupsSucceeded(), groups);
            log.info("Series failed: {}", result.getGroupsFailed());
            log.info("Total failures: {}", failureSink.getTotalFailures());
            log.info("Duration: {} seconds", durationSeconds);
            log.info("Output: {}", config.getOutputFile());
            log.info("Failures: {}", config.getFailureFile());
            return result;
        }
    }
}
