package io.github.yok.csvimporter.core;

import io.github.yok.csvimporter.parser.RowSourceException;
import lombok.Getter;

/**
 * Thrown when the source file cannot be read any further while loading.
 *
 * <p>
 * A parse error leaves the reader at an unknown position, so the load stops even with
 * continue-on-error. Rows from {@link #getFirstUnloadedRow()} on were not persisted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class SourceReadException extends LoadAbortedException {

    private static final long serialVersionUID = 1L;

    // One-based data row number of the first row of the batch that could not be read
    private final long firstUnloadedRow;

    /**
     * Creates an exception.
     *
     * @param table qualified table name
     * @param firstUnloadedRow one-based data row number of the first row not loaded
     * @param summary summary of everything committed so far
     * @param cause read failure of the row source
     */
    public SourceReadException(String table, long firstUnloadedRow, LoadSummary summary,
            RowSourceException cause) {
        super(table, "Reading the source failed; rows from " + firstUnloadedRow
                + " on were not loaded: " + cause.getMessage(), summary, cause);
        this.firstUnloadedRow = firstUnloadedRow;
    }
}
