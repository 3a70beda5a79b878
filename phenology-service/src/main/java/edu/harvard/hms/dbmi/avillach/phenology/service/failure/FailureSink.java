package edu.harvard.hms.dbmi.avillach.phenology.service.failure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSONL failure sink. Writes one JSON object per line and a rollup of failures per reason when closed.
 *
 * Thread-safe.
 */
public class FailureSink implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FailureSink.class);

    private final Path outputFile;
    private final BufferedWriter writer;
    private final ObjectMapper mapper;

    private final Map<FailureReason, AtomicLong> rollupCounters = new EnumMap<>(FailureReason.class);
    private final AtomicLong totalFailures = new AtomicLong(0);

    public FailureSink(Path outputFile) throws IOException {
        this.outputFile = outputFile;
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(outputFile,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);

        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        log.info("Initialized failure sink: {}", outputFile);
    }

    /**
     * Records a failure (thread-safe).
     */
    public synchronized void recordFailure(FailureRecord record) {
        try {
            writer.write(mapper.writeValueAsString(record));
            writer.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write failure record to " + outputFile, e);
        }

        FailureReason reason = record.reasonCode() != null ? record.reasonCode() : FailureReason.UNKNOWN;
        rollupCounters.computeIfAbsent(reason, k -> new AtomicLong(0)).incrementAndGet();
        totalFailures.incrementAndGet();
    }

    /**
     * Writes rollup summary at end of run.
     */
    public synchronized void writeRollup() throws IOException {
        writer.write("\n--- ROLLUP SUMMARY ---\n");
        for (Map.Entry<FailureReason, AtomicLong> entry : rollupCounters.entrySet()) {
            writer.write(String.format("  %s: %d\n", entry.getKey(), entry.getValue().get()));
        }
        writer.write(String.format("Total Failures: %d\n", totalFailures.get()));
        writer.flush();

        log.info("Wrote rollup summary: {} total failures", totalFailures.get());
    }

    public synchronized long getFailureCount(FailureReason reason) {
        AtomicLong count = rollupCounters.get(reason);
        return count != null ? count.get() : 0;
    }

    public long getTotalFailures() {
        return totalFailures.get();
    }

    public Path getOutputFile() {
        return outputFile;
    }

    @Override
    public void close() throws IOException {
        try {
            writeRollup();
        } finally {
            writer.close();
        }
        log.info("Closed failure sink: {}", outputFile);
    }
}
