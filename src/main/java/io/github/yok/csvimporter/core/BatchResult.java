package io.github.yok.csvimporter.core;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one committed batch.
 *
 * <p>
 * A batch is one transaction, so {@link #getInsertedRows()} equals {@link #getRowsAttempted()} for
 * every batch that is recorded here.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class BatchResult {

    // Zero-based batch index
    private final int batchIndex;

    // One-based data row numbers (header excluded) covered by the batch
    private final long firstRow;
    private final long lastRow;

    // Rows sent to the destination
    private final int rowsAttempted;

    // Rows the destination acknowledged
    private final int insertedRows;

    // Wall-clock time of the insert and commit
    private final long elapsedMillis;

    /**
     * Insert throughput of the batch.
     *
     * @return rows per second
     */
    public double rowsPerSecond() {
        return LoadSummary.rate(insertedRows, elapsedMillis);
    }
}
