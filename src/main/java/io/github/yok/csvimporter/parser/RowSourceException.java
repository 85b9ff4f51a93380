package io.github.yok.csvimporter.parser;

import io.github.yok.csvimporter.core.CsvImportException;
import lombok.Getter;

/**
 * Thrown when the source file cannot be opened, read or parsed.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class RowSourceException extends CsvImportException {

    private static final long serialVersionUID = 1L;

    // Source file description
    private final String source;

    /**
     * Creates an exception.
     *
     * @param source source file description
     * @param message detail message
     * @param cause underlying failure, may be {@code null}
     */
    public RowSourceException(String source, String message, Throwable cause) {
        super(null, message + " [" + source + "]", cause);
        this.source = source;
    }
}
