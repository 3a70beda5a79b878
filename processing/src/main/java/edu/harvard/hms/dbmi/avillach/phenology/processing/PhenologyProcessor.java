package edu.harvard.hms.dbmi.avillach.phenology.processing;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.MetricsRecord;
import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.StrategyType;
import edu.harvard.hms.dbmi.avillach.phenology.data.observation.SeriesGroup;
import edu.harvard.hms.dbmi.avillach.phenology.exception.InsufficientDataException;
import edu.harvard.hms.dbmi.avillach.phenology.exception.InvalidParameterException;
import edu.harvard.hms.dbmi.avillach.phenology.exception.MalformedObservationException;
import edu.harvard.hms.dbmi.avillach.phenology.processing.parse.InputRow;
import edu.harvard.hms.dbmi.avillach.phenology.processing.parse.ObservationParser;
import edu.harvard.hms.dbmi.avillach.phenology.processing.parse.ParsedRow;
import edu.harvard.hms.dbmi.avillach.phenology.processing.strategy.PhenologyStrategy;
import edu.harvard.hms.dbmi.avillach.phenology.processing.strategy.RawNonZeroStrategy;
import edu.harvard.hms.dbmi.avillach.phenology.processing.strategy.SmoothedThresholdStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

/**
 * Runs a batch: parse rows as they arrive, group them, analyse every group with the selected strategy on a worker pool.
 *
 * Groups are dispatched in series key order and results are collected in the same order, so output does not
 * depend on which worker finishes first. A bad row or a failing group is recorded and the batch carries on.
 */
public class PhenologyProcessor {

    private static final Logger log = LoggerFactory.getLogger(PhenologyProcessor.class);

    private final ObservationParser parser;

    private final SeriesGrouper grouper;

    private final Map<StrategyType, PhenologyStrategy> strategies = new EnumMap<>(StrategyType.class);

    private final int threads;

    public PhenologyProcessor(ObservationParser parser, SeriesGrouper grouper, List<PhenologyStrategy> strategies, int threads) {
        if (threads < 1) {
            throw new InvalidParameterException("threads", "must be at least 1, was " + threads);
        }
        this.parser = parser;
        this.grouper = grouper;
        for (PhenologyStrategy strategy : strategies) {
            this.strategies.put(strategy.type(), strategy);
        }
        this.threads = threads;
    }

    public static PhenologyProcessor withDefaults(int threads) {
        return new PhenologyProcessor(
            new ObservationParser(), new SeriesGrouper(), List.of(new SmoothedThresholdStrategy(), new RawNonZeroStrategy()), threads
        );
    }

    public int getThreads() {
        return threads;
    }

    public BatchResult process(Iterable<InputRow> rows, PhenologyParameters parameters) {
        ParsedObservations parsed = new ParsedObservations();
        parse(rows, parsed);
        return analyze(parsed, parameters);
    }

    /**
     * Parses one batch of rows into {@code into}. Call once per batch as rows are read, then {@link #analyze}.
     */
    public void parse(Iterable<InputRow> rows, ParsedObservations into) {
        for (InputRow row : rows) {
            try {
                ParsedRow parsed = parser.parse(row);
                into.accept(parsed.observation(), parsed.countCoerced());
            } catch (MalformedObservationException e) {
                log.warn("Dropping row {}: {} (column {}, value '{}')", row.rowNumber(), e.getMessage(), e.getColumn(), e.getRawValue());
                into.reject(ProcessingFailure.forRow(row.rowNumber(), e.getColumn(), e.getRawValue(), e.getMessage()));
            }
        }
    }

    public BatchResult analyze(ParsedObservations parsed, PhenologyParameters parameters) {
        if (parsed.getCountsCoerced() > 0) {
            log.info("{} rows had a blank or non-numeric search count, read as 0", parsed.getCountsCoerced());
        }
        List<SeriesGroup> groups = grouper.group(parsed.getObservations());
        log.info("Parsed {} of {} rows into {} series", parsed.getObservations().size(), parsed.getRowsRead(), groups.size());

        return analyzeGroups(
            groups, parameters, new ArrayList<>(parsed.getFailures()), parsed.getRowsRead(), parsed.getRowsRejected(),
            parsed.getCountsCoerced()
        );
    }

    /**
     * Analyses groups that were built elsewhere. Empty groups are skipped and reported as insufficient data.
     */
    public BatchResult processGroups(List<SeriesGroup> groups, PhenologyParameters parameters) {
        long observations = groups.stream().mapToLong(SeriesGroup::size).sum();
        return analyzeGroups(groups, parameters, new ArrayList<>(), observations, 0, 0);
    }

    private BatchResult analyzeGroups(List<SeriesGroup> groups, PhenologyParameters parameters, List<ProcessingFailure> failures,
                                      long rowsRead, long rowsRejected, long coerced) {
        PhenologyStrategy strategy = strategies.get(parameters.strategy());
        if (strategy == null) {
            throw new InvalidParameterException("strategy", "no implementation registered for " + parameters.strategy().getLabel());
        }

        log.info("Analysing {} series with {} using {} threads", groups.size(), parameters.strategy().getLabel(), threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<MetricsRecord> records = new ArrayList<>(groups.size());
        int groupsFailed = 0;
        try {
            List<Future<MetricsRecord>> futures = new ArrayList<>(groups.size());
            for (SeriesGroup group : groups) {
                futures.add(pool.submit(() -> {
                    grouper.validate(group);
                    return strategy.analyze(group, parameters);
                }));
            }

            for (int i = 0; i < futures.size(); i++) {
                SeriesGroup group = groups.get(i);
                try {
                    records.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    groupsFailed++;
                    failures.add(groupFailure(group, e.getCause()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.error("Interrupted while collecting results, {} series not analysed", futures.size() - i);
                    for (int j = i; j < futures.size(); j++) {
                        futures.get(j).cancel(true);
                        failures.add(ProcessingFailure.forGroup(ProcessingFailure.Kind.GROUP_FAILED, groups.get(j).getKey(), "Interrupted"));
                        groupsFailed++;
                    }
                    break;
                }
            }
        } finally {
            shutdown(pool);
        }

        BatchResult result = new BatchResult(parameters.strategy(), records, failures, rowsRead, rowsRejected, coerced, groupsFailed);
        log.info("Batch complete: {}", result);
        return result;
    }

    private static ProcessingFailure groupFailure(SeriesGroup group, Throwable cause) {
        ProcessingFailure.Kind kind;
        if (cause instanceof InsufficientDataException) {
            kind = ProcessingFailure.Kind.INSUFFICIENT_DATA;
            log.warn("Skipping series {}: {}", group.getKey(), cause.getMessage());
        } else if (cause instanceof InvalidParameterException) {
            kind = ProcessingFailure.Kind.INVALID_PARAMETER;
            log.warn("Series {} rejected parameters: {}", group.getKey(), cause.getMessage());
        } else {
            kind = ProcessingFailure.Kind.GROUP_FAILED;
            log.warn("Series {} failed", group.getKey(), cause);
        }
        return ProcessingFailure.forGroup(kind, group.getKey(), String.valueOf(cause.getMessage()));
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("Worker pool did not terminate within 1 minute, forcing shutdown");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for worker pool to terminate", e);
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
