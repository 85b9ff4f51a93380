package io.github.yok.csvimporter.core;

import lombok.Getter;

/**
 * Thrown on {@link ConflictPolicy#APPEND} when a CSV column is missing from the existing table or
 * its inferred type cannot be stored in the existing column without narrowing.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class SchemaMismatchException extends CsvImportException {

    private static final long serialVersionUID = 1L;

    // Offending column name
    private final String column;

    // Type inferred from the CSV
    private final String desiredType;

    // Type of the existing column; null when the column does not exist
    private final String existingType;

    /**
     * Creates an exception.
     *
     * @param table qualified table name
     * @param column offending column name
     * @param desiredType inferred type
     * @param existingType existing column type, or {@code null} if the column is missing
     */
    public SchemaMismatchException(String table, String column, String desiredType,
            String existingType) {
        super(table, buildMessage(table, column, desiredType, existingType));
        this.column = column;
        this.desiredType = desiredType;
        this.existingType = existingType;
    }

    private static String buildMessage(String table, String column, String desiredType,
            String existingType) {
        if (existingType == null) {
            return "Column '" + column + "' (" + desiredType + ") does not exist in table "
                    + table;
        }
        return "Column '" + column + "' of table " + table + " is " + existingType
                + " and cannot hold " + desiredType + " values";
    }
}
