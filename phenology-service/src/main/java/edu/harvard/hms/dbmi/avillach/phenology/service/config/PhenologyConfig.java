package edu.harvard.hms.dbmi.avillach.phenology.service.config;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.StrategyType;
import edu.harvard.hms.dbmi.avillach.phenology.exception.InvalidParameterException;
import edu.harvard.hms.dbmi.avillach.phenology.processing.PhenologyParameters;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the phenology service.
 *
 * Uses Spring Boot property binding with fail-fast validation.
 * All properties use the "phenology.*" prefix.
 */
@ConfigurationProperties(prefix = "phenology")
public class PhenologyConfig {
    private static final Logger log = LoggerFactory.getLogger(PhenologyConfig.class);

    static final String DEFAULT_OUTPUT_FILE_NAME = "phenology_analysis.csv";
    static final String DEFAULT_FAILURE_FILE_NAME = "failures.jsonl";

    // Required properties
    private String inputFile;

    // Optional properties with defaults
    private String outputFile; // null = <input dir>/phenology_analysis.csv
    private String failureFile; // null = <output dir>/failures.jsonl
    private double sigma = PhenologyParameters.DEFAULT_SIGMA;
    private double thresholdPct = PhenologyParameters.DEFAULT_THRESHOLD_PCT;
    private String strategy = StrategyType.SMOOTHED_THRESHOLD.getLabel();
    private Integer threads; // null = available processors
    private int batchSize = 10000;

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING CONFIGURATION ===");

        if (inputFile == null || inputFile.isBlank()) {
            String errorMsg = "Missing required configuration property: phenology.input-file";
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        List<String> errors = new ArrayList<>();

        Path inputPath = Path.of(inputFile);
        if (!Files.exists(inputPath)) {
            errors.add("Input file not found: " + inputFile);
        } else if (!Files.isRegularFile(inputPath)) {
            errors.add("Input path is not a file: " + inputFile);
        }

        // Set defaults for optional properties
        if (outputFile == null || outputFile.isBlank()) {
            Path inputDir = inputPath.toAbsolutePath().getParent();
            outputFile = inputDir.resolve(DEFAULT_OUTPUT_FILE_NAME).toString();
        }
        Path outputDir = Path.of(outputFile).toAbsolutePath().getParent();
        if (failureFile == null || failureFile.isBlank()) {
            failureFile = outputDir.resolve(DEFAULT_FAILURE_FILE_NAME).toString();
        }
        if (threads == null) {
            threads = Runtime.getRuntime().availableProcessors();
        }

        try {
            Files.createDirectories(outputDir);
            if (!Files.isWritable(outputDir)) {
                errors.add("Output directory is not writable: " + outputDir);
            }
        } catch (IOException e) {
            errors.add("Cannot create output directory: " + outputDir + " - " + e.getMessage());
        }

        try {
            PhenologyParameters.validateSigma(sigma);
        } catch (InvalidParameterException e) {
            errors.add("phenology.sigma " + e.getMessage());
        }
        try {
            PhenologyParameters.validateThresholdPct(thresholdPct);
        } catch (InvalidParameterException e) {
            errors.add("phenology.threshold-pct " + e.getMessage());
        }
        try {
            StrategyType.fromLabel(strategy);
        } catch (InvalidParameterException e) {
            errors.add("phenology.strategy " + e.getMessage());
        }
        if (threads < 1) {
            errors.add("phenology.threads must be at least 1, was " + threads);
        }
        if (batchSize < 1) {
            errors.add("phenology.batch-size must be at least 1, was " + batchSize);
        }

        // Fail fast if any errors
        if (!errors.isEmpty()) {
            String errorMsg = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        log.info("=== EFFECTIVE CONFIGURATION ===");
        log.info("Input file: {}", inputFile);
        log.info("Output file: {}", outputFile);
        log.info("Failure file: {}", failureFile);
        log.info("Strategy: {}", getStrategyType().getLabel());
        log.info("Sigma: {}", sigma);
        log.info("Threshold pct: {}", thresholdPct);
        log.info("Threads: {}", threads);
        log.info("Batch size: {}", batchSize);
        log.info("================================");
    }

    public PhenologyParameters toParameters() {
        return new PhenologyParameters(sigma, thresholdPct, getStrategyType());
    }

    public StrategyType getStrategyType() {
        return StrategyType.fromLabel(strategy);
    }

    public String getInputFile() {
        return inputFile;
    }

    public void setInputFile(String inputFile) {
        this.inputFile = inputFile;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }

    public String getFailureFile() {
        return failureFile;
    }

    public void setFailureFile(String failureFile) {
        this.failureFile = failureFile;
    }

    public double getSigma() {
        return sigma;
    }

    public void setSigma(double sigma) {
        this.sigma = sigma;
    }

    public double getThresholdPct() {
        return thresholdPct;
    }

    public void setThresholdPct(double thresholdPct) {
        this.thresholdPct = thresholdPct;
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public Integer getThreads() {
        return threads;
    }

    public void setThreads(Integer threads) {
        this.threads = threads;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }
}
