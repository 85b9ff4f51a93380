package io.github.yok.csvimporter.core;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A batch that could not be inserted.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class BatchFailure {

    // Zero-based batch index
    private final int batchIndex;

    // One-based data row numbers (header excluded) covered by the batch
    private final long firstRow;
    private final long lastRow;

    // Short description of the cause
    private final String reason;

    /**
     * Number of rows in the failed batch.
     *
     * @return row count
     */
    public long rowCount() {
        return lastRow - firstRow + 1;
    }
}
