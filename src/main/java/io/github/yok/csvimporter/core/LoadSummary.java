package io.github.yok.csvimporter.core;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

/**
 * What an import run persisted.
 *
 * <p>
 * A summary is created per run and filled in by {@link BatchLoader} as batches are committed or
 * fail. {@link #getInsertedRows()} always equals the number of rows committed to the destination
 * and the sum of {@link BatchResult#getInsertedRows()} over {@link #getBatchResults()}. The list of
 * recorded failures is capped; {@link #getFailedBatches()} and {@link #getSkippedRows()} stay
 * exact.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString(exclude = "batchResults")
public final class LoadSummary {

    // Qualified destination table
    private final String table;

    // Maximum number of failures kept in the failures list
    @Getter(AccessLevel.NONE)
    private final int maxRecordedFailures;

    // Data rows read from the source (header excluded)
    private long rowsRead;

    // Rows committed to the destination
    private long insertedRows;

    // Rows of failed batches that were skipped
    private long skippedRows;

    // Batches committed
    private int committedBatches;

    // Batches that failed (exact, not capped)
    private int failedBatches;

    // Whether the run stopped on a cancellation request
    private boolean cancelled;

    // Wall-clock time of the load phase
    private long elapsedMillis;

    @Getter(AccessLevel.NONE)
    private final List<BatchResult> batchResults = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<BatchFailure> failures = new ArrayList<>();

    /**
     * Creates an empty summary.
     *
     * @param table qualified destination table
     * @param maxRecordedFailures maximum number of failures kept
     */
    public LoadSummary(String table, int maxRecordedFailures) {
        this.table = table;
        this.maxRecordedFailures = Math.max(0, maxRecordedFailures);
    }

    /**
     * Committed batches in load order.
     *
     * @return batch results
     */
    public List<BatchResult> getBatchResults() {
        return ImmutableList.copyOf(batchResults);
    }

    /**
     * Recorded batch failures, at most the configured maximum.
     *
     * @return failures in batch order
     */
    public List<BatchFailure> getFailures() {
        return ImmutableList.copyOf(failures);
    }

    /**
     * Overall insert throughput of the load phase.
     *
     * @return committed rows per second of elapsed time
     */
    public double rowsPerSecond() {
        return rate(insertedRows, elapsedMillis);
    }

    /**
     * Returns whether every row read was committed.
     *
     * @return {@code true} if nothing failed and the run was not cancelled
     */
    public boolean isComplete() {
        return failedBatches == 0 && !cancelled;
    }

    void recordBatch(BatchResult result) {
        rowsRead += result.getRowsAttempted();
        insertedRows += result.getInsertedRows();
        committedBatches++;
        batchResults.add(result);
    }

    void recordFailure(BatchFailure failure) {
        rowsRead += failure.rowCount();
        skippedRows += failure.rowCount();
        failedBatches++;
        if (failures.size() < maxRecordedFailures) {
            failures.add(failure);
        }
    }

    void markCancelled() {
        cancelled = true;
    }

    void finish(long elapsedMillis) {
        this.elapsedMillis = elapsedMillis;
    }

    static double rate(long rows, long elapsedMillis) {
        return elapsedMillis <= 0 ? rows * 1000.0 : rows * 1000.0 / elapsedMillis;
    }
}
