package io.github.yok.csvimporter.core;

import com.google.common.base.Preconditions;
import io.github.yok.csvimporter.parser.RowSourceException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Streams rows into the destination in fixed-size batches.
 *
 * <p>
 * Rows are pulled lazily from the iterator, so memory is bounded by one batch. Each batch is one
 * transaction. In fail-fast mode the first failed batch aborts the load with a
 * {@link BatchLoadException}; with continue-on-error its rows are counted as skipped and loading
 * proceeds with the next batch. A read failure of the row source always aborts the load with a
 * {@link SourceReadException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class BatchLoader {

    private final DestinationConnector connector;

    // Maximum number of failures kept in the summary
    private final int maxRecordedFailures;

    /**
     * Loads every row.
     *
     * @param rows rows keyed by source column name
     * @param plan reconciled plan
     * @param batchSize rows per batch, positive
     * @param continueOnError {@code true} to skip failed batches instead of aborting
     * @param cancellation polled before each batch; {@code true} stops the load
     * @return summary of the committed and skipped rows
     * @throws IllegalArgumentException if {@code batchSize} is not positive
     * @throws BatchLoadException in fail-fast mode when a batch fails
     * @throws SourceReadException when the row source fails while loading
     */
    public LoadSummary load(Iterator<Map<String, String>> rows, ReconciledPlan plan,
            int batchSize, boolean continueOnError, BooleanSupplier cancellation) {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive: %s", batchSize);
        String table = plan.getQualifiedName();
        LoadSummary summary = new LoadSummary(table, maxRecordedFailures);
        long loadStart = System.currentTimeMillis();

        int batchIndex = 0;
        long nextRow = 1;
        while (true) {
            List<Map<String, String>> batch;
            try {
                if (!rows.hasNext()) {
                    break;
                }
                if (cancellation.getAsBoolean()) {
                    log.warn("Table[{}] Cancellation requested before batch {}; stopping", table,
                            batchIndex);
                    summary.markCancelled();
                    break;
                }
                batch = nextBatch(rows, batchSize);
            } catch (RowSourceException e) {
                summary.finish(System.currentTimeMillis() - loadStart);
                log.error("Table[{}] Reading the source failed before batch {}; aborting after {}"
                        + " committed rows", table, batchIndex, summary.getInsertedRows());
                throw new SourceReadException(table, nextRow, summary, e);
            }
            long firstRow = nextRow;
            long lastRow = nextRow + batch.size() - 1;
            nextRow = lastRow + 1;

            long start = System.currentTimeMillis();
            try {
                int inserted = connector.insertBatch(plan, batch, batchIndex);
                BatchResult result = new BatchResult(batchIndex, firstRow, lastRow, batch.size(),
                        inserted, System.currentTimeMillis() - start);
                summary.recordBatch(result);
                log.info("Batch {}: Inserted {} rows in {} seconds ({} rows/sec)", batchIndex,
                        inserted, String.format("%.2f", result.getElapsedMillis() / 1000.0),
                        String.format("%.2f", result.rowsPerSecond()));
            } catch (RuntimeException e) {
                BatchFailure failure = new BatchFailure(batchIndex, firstRow, lastRow,
                        ExceptionUtils.getRootCauseMessage(e));
                summary.recordFailure(failure);
                if (!continueOnError) {
                    summary.finish(System.currentTimeMillis() - loadStart);
                    log.error("Table[{}] Batch {} (rows {}-{}) failed; aborting", table,
                            batchIndex, firstRow, lastRow);
                    throw new BatchLoadException(table, failure, summary, e);
                }
                log.warn("Table[{}] Batch {} (rows {}-{}) failed and was skipped: {}", table,
                        batchIndex, firstRow, lastRow, failure.getReason());
            }
            batchIndex++;
        }

        summary.finish(System.currentTimeMillis() - loadStart);
        log.info("Table[{}] Load finished | inserted={}, skipped={}, batches={}, failed={},"
                + " rows/sec={}", table, summary.getInsertedRows(), summary.getSkippedRows(),
                summary.getCommittedBatches(), summary.getFailedBatches(),
                String.format("%.2f", summary.rowsPerSecond()));
        return summary;
    }

    private static List<Map<String, String>> nextBatch(Iterator<Map<String, String>> rows,
            int batchSize) {
        List<Map<String, String>> batch = new ArrayList<>(Math.min(batchSize, 1024));
        while (batch.size() < batchSize && rows.hasNext()) {
            batch.add(rows.next());
        }
        return batch;
    }
}
