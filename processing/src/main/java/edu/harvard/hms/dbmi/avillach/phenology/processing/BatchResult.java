package edu.harvard.hms.dbmi.avillach.phenology.processing;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.MetricsRecord;
import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.StrategyType;

import java.util.List;

/**
 * Outcome of one batch: records in series key order, every failure, and the counts that reconcile them.
 * rowsRead = observations + rowsRejected, and groupsSucceeded + groupsFailed = number of groups dispatched.
 */
public class BatchResult {

    private final StrategyType strategy;

    private final ImmutableList<MetricsRecord> records;

    private final ImmutableList<ProcessingFailure> failures;

    private final long rowsRead;

    private final long rowsRejected;

    private final long countsCoerced;

    private final int groupsFailed;

    public BatchResult(StrategyType strategy, List<MetricsRecord> records, List<ProcessingFailure> failures, long rowsRead,
                       long rowsRejected, long countsCoerced, int groupsFailed) {
        this.strategy = strategy;
        this.records = ImmutableList.copyOf(records);
        this.failures = ImmutableList.copyOf(failures);
        this.rowsRead = rowsRead;
        this.rowsRejected = rowsRejected;
        this.countsCoerced = countsCoerced;
        this.groupsFailed = groupsFailed;
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public List<MetricsRecord> getRecords() {
        return records;
    }

    public List<ProcessingFailure> getFailures() {
        return failures;
    }

    public long getRowsRead() {
        return rowsRead;
    }

    public long getRowsRejected() {
        return rowsRejected;
    }

    /**
     * Rows kept with a blank or non-numeric search count read as 0.
     */
    public long getCountsCoerced() {
        return countsCoerced;
    }

    public int getGroupsSucceeded() {
        return records.size();
    }

    public int getGroupsFailed() {
        return groupsFailed;
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        return String.format(
            "strategy=%s rowsRead=%d rowsRejected=%d countsCoerced=%d groupsSucceeded=%d groupsFailed=%d", strategy.getLabel(),
            rowsRead, rowsRejected, countsCoerced, getGroupsSucceeded(), groupsFailed
        );
    }
}
