package io.github.yok.csvimporter.core;

/**
 * Thrown when the destination table already exists and the conflict policy is
 * {@link ConflictPolicy#FAIL}. No DDL or data has been sent when this is raised.
 *
 * @author Yasuharu.Okawauchi
 */
public class TableExistsException extends CsvImportException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception.
     *
     * @param table qualified name of the existing table
     */
    public TableExistsException(String table) {
        super(table, "Table " + table + " already exists (use --if-exists replace or append)");
    }
}
