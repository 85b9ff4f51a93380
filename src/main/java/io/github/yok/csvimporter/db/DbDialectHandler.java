package io.github.yok.csvimporter.db;

import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.config.DataTypeFactoryMode;
import io.github.yok.csvimporter.schema.ColumnType;
import io.github.yok.csvimporter.schema.IdentifierRules;
import io.github.yok.csvimporter.schema.TableSchema;
import java.sql.Connection;
import java.sql.SQLException;
import org.dbunit.database.DefaultMetadataHandler;
import org.dbunit.database.IMetadataHandler;
import org.dbunit.dataset.datatype.IDataTypeFactory;

/**
 * Database-specific behavior needed to create, inspect and fill tables.
 *
 * <p>
 * A handler is stateless: it renders SQL and maps types, but holds no connection.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler {

    /**
     * Database type this handler serves.
     *
     * @return database type
     */
    DataTypeFactoryMode getMode();

    /**
     * Quotes an identifier so that it is used verbatim.
     *
     * @param identifier raw identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Pattern DBUnit uses to escape table and column names ({@code ?} is the name).
     *
     * @return escape pattern
     */
    String getEscapePattern();

    /**
     * Quotes and qualifies a table name.
     *
     * @param schema schema, or {@code null}
     * @param table table name
     * @return quoted, qualified name
     */
    default String qualifyTable(String schema, String table) {
        if (schema == null || schema.isEmpty()) {
            return quoteIdentifier(table);
        }
        return quoteIdentifier(schema) + "." + quoteIdentifier(table);
    }

    /**
     * Renders the SQL type of a column.
     *
     * @param type resolved column type
     * @return SQL type declaration
     */
    String toSqlType(ColumnType type);

    /**
     * Maps a column reported by {@link java.sql.DatabaseMetaData#getColumns} back to a column type.
     *
     * @param jdbcType JDBC type code ({@code DATA_TYPE})
     * @param typeName database type name ({@code TYPE_NAME})
     * @param size column size ({@code COLUMN_SIZE})
     * @param decimalDigits scale or fractional seconds ({@code DECIMAL_DIGITS})
     * @return column type, or {@code null} when the database type has no counterpart
     */
    ColumnType fromJdbcType(int jdbcType, String typeName, int size, int decimalDigits);

    /**
     * Builds {@code CREATE TABLE} for a schema.
     *
     * @param schema table definition
     * @return DDL statement
     */
    String buildCreateTableSql(TableSchema schema);

    /**
     * Builds {@code DROP TABLE}.
     *
     * @param schema schema, or {@code null}
     * @param table table name
     * @return DDL statement
     */
    default String buildDropTableSql(String schema, String table) {
        return "DROP TABLE " + qualifyTable(schema, table);
    }

    /**
     * Identifier rules of this database.
     *
     * @return identifier rules
     */
    IdentifierRules getIdentifierRules();

    /**
     * Schema used when neither the request nor the connection names one.
     *
     * @param entry connection entry
     * @return default schema
     */
    String resolveSchema(ConnectionConfig.Entry entry);

    /**
     * Whether the database calls its namespaces catalogs rather than schemas (MySQL).
     *
     * @return {@code true} if the schema name is passed as the JDBC catalog
     */
    default boolean isSchemaCatalog() {
        return false;
    }

    /**
     * Whether boolean columns are numeric on this database (Oracle {@code NUMBER(1)}).
     *
     * @return {@code true} if booleans are bound as {@code 1}/{@code 0}
     */
    default boolean isBooleanNumeric() {
        return false;
    }

    /**
     * Vendor data type factory for DBUnit.
     *
     * @return data type factory
     */
    IDataTypeFactory getDataTypeFactory();

    /**
     * Metadata handler DBUnit uses to look up tables and columns.
     *
     * @return metadata handler
     */
    default IMetadataHandler getMetadataHandler() {
        return new DefaultMetadataHandler();
    }

    /**
     * Applies session settings after the connection is opened.
     *
     * @param connection JDBC connection
     * @throws SQLException on SQL errors
     */
    default void prepareConnection(Connection connection) throws SQLException {
        // no session settings by default
    }
}
