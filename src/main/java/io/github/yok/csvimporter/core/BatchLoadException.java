package io.github.yok.csvimporter.core;

import lombok.Getter;

/**
 * Thrown in fail-fast mode when a batch cannot be inserted.
 *
 * <p>
 * The attached {@link LoadSummary} describes everything committed before the failing batch. Rows
 * of the failing batch and of all later batches were not persisted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class BatchLoadException extends LoadAbortedException {

    private static final long serialVersionUID = 1L;

    // Zero-based index of the failing batch
    private final int batchIndex;

    // One-based data row numbers covered by the failing batch
    private final long firstRow;
    private final long lastRow;

    /**
     * Creates an exception.
     *
     * @param table qualified table name
     * @param failure failure record of the batch
     * @param summary summary of everything committed so far
     * @param cause underlying failure
     */
    public BatchLoadException(String table, BatchFailure failure, LoadSummary summary,
            Throwable cause) {
        super(table, "Batch " + failure.getBatchIndex() + " (rows " + failure.getFirstRow() + "-"
                + failure.getLastRow() + ") failed: " + failure.getReason(), summary, cause);
        this.batchIndex = failure.getBatchIndex();
        this.firstRow = failure.getFirstRow();
        this.lastRow = failure.getLastRow();
    }
}
