package io.github.yok.csvimporter.core;

import lombok.Getter;

/**
 * Thrown when the load phase stops before every row was read.
 *
 * <p>
 * The attached {@link LoadSummary} describes everything committed before the abort.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public abstract class LoadAbortedException extends CsvImportException {

    private static final long serialVersionUID = 1L;

    // Summary of the committed batches
    private final transient LoadSummary summary;

    /**
     * Creates an exception.
     *
     * @param table qualified table name
     * @param message detail message
     * @param summary summary of everything committed so far
     * @param cause underlying failure
     */
    protected LoadAbortedException(String table, String message, LoadSummary summary,
            Throwable cause) {
        super(table, message, cause);
        this.summary = summary;
    }
}
