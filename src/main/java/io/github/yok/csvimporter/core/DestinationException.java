package io.github.yok.csvimporter.core;

import lombok.Getter;

/**
 * Wraps a database failure together with the operation and batch it occurred in.
 *
 * <p>
 * The original {@link java.sql.SQLException} (or DBUnit exception) is kept as the cause.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class DestinationException extends CsvImportException {

    private static final long serialVersionUID = 1L;

    // Operation that failed
    private final DestinationOperation operation;

    // Zero-based batch index; null outside batch inserts
    private final Integer batchIndex;

    /**
     * Creates an exception for a non-batch operation.
     *
     * @param operation failed operation
     * @param table qualified table name
     * @param cause underlying failure
     */
    public DestinationException(DestinationOperation operation, String table, Throwable cause) {
        this(operation, table, null, cause);
    }

    /**
     * Creates an exception.
     *
     * @param operation failed operation
     * @param table qualified table name
     * @param batchIndex zero-based batch index, or {@code null}
     * @param cause underlying failure
     */
    public DestinationException(DestinationOperation operation, String table, Integer batchIndex,
            Throwable cause) {
        super(table, operation + " failed on " + table
                + (batchIndex == null ? "" : " (batch " + batchIndex + ")") + ": "
                + cause.getMessage(), cause);
        this.operation = operation;
        this.batchIndex = batchIndex;
    }
}
