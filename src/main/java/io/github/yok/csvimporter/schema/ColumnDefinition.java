package io.github.yok.csvimporter.schema;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One column of a {@link TableSchema}.
 *
 * <p>
 * For schemas inferred from a CSV file, {@code sourceName} is the header as it appears in the file
 * and {@code name} is its sanitized identifier. For schemas read from an existing table,
 * {@code sourceName} equals {@code name} and {@code declaredTypeName} holds the database type name
 * reported by JDBC metadata.
 * </p>
 *
 * <p>
 * An untyped column carries a placeholder type because the sample held no evidence for it (type
 * inference disabled, or only empty values). When appending, it fits any existing column type.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class ColumnDefinition {

    // Identifier used in the destination table
    private final String name;

    // Header name in the source file (or the column name for existing tables)
    private final String sourceName;

    // Resolved type; null when an existing column's database type has no counterpart
    private final ColumnType type;

    // Database type name as declared in the destination (null for inferred columns)
    private final String declaredTypeName;

    // Type is a placeholder, not derived from sampled values
    private final boolean untyped;

    /**
     * Creates a typed column definition.
     *
     * @param name identifier used in the destination table
     * @param sourceName header name in the source file
     * @param type resolved type
     * @param declaredTypeName database type name, {@code null} for inferred columns
     */
    public ColumnDefinition(String name, String sourceName, ColumnType type,
            String declaredTypeName) {
        this(name, sourceName, type, declaredTypeName, false);
    }

    /**
     * Creates a column definition for an inferred column.
     *
     * @param name sanitized identifier
     * @param sourceName header name in the source file
     * @param type resolved type
     * @return column definition
     */
    public static ColumnDefinition inferred(String name, String sourceName, ColumnType type) {
        return new ColumnDefinition(name, sourceName, type, null);
    }

    /**
     * Creates a column definition whose type was not derived from sampled values.
     *
     * @param name sanitized identifier
     * @param sourceName header name in the source file
     * @param type placeholder type used when the table is created
     * @return untyped column definition
     */
    public static ColumnDefinition untyped(String name, String sourceName, ColumnType type) {
        return new ColumnDefinition(name, sourceName, type, null, true);
    }

    /**
     * Creates a column definition for a column read from the destination database.
     *
     * @param name column name as stored in the database
     * @param type mapped type, or {@code null} when the database type is not supported
     * @param declaredTypeName database type name
     * @return column definition
     */
    public static ColumnDefinition existing(String name, ColumnType type,
            String declaredTypeName) {
        return new ColumnDefinition(name, name, type, declaredTypeName);
    }

    /**
     * Describes the column type for messages, falling back to the declared database type name.
     *
     * @return printable type description
     */
    public String describeType() {
        if (type != null) {
            return type.toString();
        }
        return declaredTypeName == null ? "UNKNOWN" : declaredTypeName;
    }
}
