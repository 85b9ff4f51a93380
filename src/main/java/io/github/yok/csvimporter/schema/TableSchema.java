package io.github.yok.csvimporter.schema;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Ordered column layout of a destination table.
 *
 * <p>
 * Column names are unique, compared case-insensitively because the supported databases fold
 * unquoted identifiers.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TableSchema {

    // Schema (namespace) of the table; may be null when the connection default applies
    private final String schema;

    // Table name
    private final String tableName;

    // Columns in table order
    private final List<ColumnDefinition> columns;

    // Auto-generated primary key created ahead of the columns; null when absent
    private final String identityColumn;

    /**
     * Creates a table schema.
     *
     * @param schema schema name, or {@code null}
     * @param tableName table name
     * @param columns columns in table order
     * @throws IllegalArgumentException if the table name is blank or column names collide
     */
    public TableSchema(String schema, String tableName, List<ColumnDefinition> columns) {
        this(schema, tableName, columns, null);
    }

    private TableSchema(String schema, String tableName, List<ColumnDefinition> columns,
            String identityColumn) {
        Preconditions.checkArgument(tableName != null && !tableName.isBlank(),
                "tableName must not be blank");
        Set<String> seen = new HashSet<>();
        for (ColumnDefinition column : columns) {
            Preconditions.checkArgument(seen.add(column.getName().toLowerCase(Locale.ROOT)),
                    "duplicate column name: %s", column.getName());
        }
        this.schema = schema;
        this.tableName = tableName;
        this.columns = ImmutableList.copyOf(columns);
        this.identityColumn = identityColumn;
    }

    /**
     * Returns a copy of this schema with a generated key column. The key column is only used when
     * the table is created; rows are inserted into {@link #getColumns()} alone.
     *
     * @param name key column name
     * @return schema with the identity column
     * @throws IllegalArgumentException if the name is blank or equals a column name
     */
    public TableSchema withIdentityColumn(String name) {
        Preconditions.checkArgument(name != null && !name.isBlank(),
                "identity column name must not be blank");
        Preconditions.checkArgument(findColumn(name).isEmpty(),
                "identity column %s collides with a CSV column", name);
        return new TableSchema(schema, tableName, columns, name);
    }

    /**
     * Looks up a column by name, ignoring case.
     *
     * @param name column name
     * @return matching column, or empty
     */
    public Optional<ColumnDefinition> findColumn(String name) {
        return columns.stream().filter(c -> c.getName().equalsIgnoreCase(name)).findFirst();
    }

    /**
     * Returns the column names in table order.
     *
     * @return column names
     */
    public List<String> getColumnNames() {
        return columns.stream().map(ColumnDefinition::getName).collect(Collectors.toList());
    }

    /**
     * Returns {@code schema.table}, or just the table name when no schema is set.
     *
     * @return qualified name for logs and messages
     */
    public String getQualifiedName() {
        return qualify(schema, tableName);
    }

    /**
     * Joins a schema and table name for logs and messages.
     *
     * @param schema schema, may be {@code null}
     * @param tableName table name
     * @return {@code schema.table} or {@code table}
     */
    public static String qualify(String schema, String tableName) {
        return schema == null || schema.isEmpty() ? tableName : schema + "." + tableName;
    }
}
