package io.github.yok.csvimporter.core;

import lombok.Getter;

/**
 * Base class of every failure raised by an import run.
 *
 * <p>
 * Carries the qualified name of the destination table the run was targeting. All subclasses are
 * unchecked so that they propagate unchanged from the pipeline to the CLI entry point.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class CsvImportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Qualified destination table name (may be null for failures before a table is known)
    private final String table;

    /**
     * Creates an exception.
     *
     * @param table qualified destination table name
     * @param message detail message
     */
    public CsvImportException(String table, String message) {
        super(message);
        this.table = table;
    }

    /**
     * Creates an exception with a cause.
     *
     * @param table qualified destination table name
     * @param message detail message
     * @param cause underlying failure
     */
    public CsvImportException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }
}
