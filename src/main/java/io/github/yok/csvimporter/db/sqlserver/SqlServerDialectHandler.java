package io.github.yok.csvimporter.db.sqlserver;

import com.google.common.collect.ImmutableSet;
import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.config.DataTypeFactoryMode;
import io.github.yok.csvimporter.db.AbstractDbDialectHandler;
import io.github.yok.csvimporter.schema.ColumnType;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Set;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.mssql.MsSqlDataTypeFactory;

/**
 * SQL Server dialect handler.
 *
 * <p>
 * Text is stored as {@code NVARCHAR} so that non-ASCII values survive regardless of the database
 * collation. Identifiers are bracket-quoted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlServerDialectHandler extends AbstractDbDialectHandler {

    /**
     * Maximum identifier length ({@code sysname}).
     */
    public static final int MAX_IDENTIFIER_LENGTH = 128;

    /**
     * Transact-SQL reserved keywords.
     */
    public static final Set<String> RESERVED_WORDS = ImmutableSet.of("add", "all", "alter", "and",
            "any", "as", "asc", "authorization", "backup", "begin", "between", "break", "browse",
            "bulk", "by", "cascade", "case", "check", "checkpoint", "close", "clustered",
            "coalesce", "collate", "column", "commit", "compute", "constraint", "contains",
            "containstable", "continue", "convert", "create", "cross", "current", "current_date",
            "current_time", "current_timestamp", "current_user", "cursor", "database", "dbcc",
            "deallocate", "declare", "default", "delete", "deny", "desc", "disk", "distinct",
            "distributed", "double", "drop", "dump", "else", "end", "errlvl", "escape", "except",
            "exec", "execute", "exists", "exit", "external", "fetch", "file", "fillfactor", "for",
            "foreign", "freetext", "freetexttable", "from", "full", "function", "goto", "grant",
            "group", "having", "holdlock", "identity", "identity_insert", "identitycol", "if",
            "in", "index", "inner", "insert", "intersect", "into", "is", "join", "key", "kill",
            "left", "like", "lineno", "load", "merge", "national", "nocheck", "nonclustered",
            "not", "null", "nullif", "of", "off", "offsets", "on", "open", "opendatasource",
            "openquery", "openrowset", "openxml", "option", "or", "order", "outer", "over",
            "percent", "pivot", "plan", "precision", "primary", "print", "proc", "procedure",
            "public", "raiserror", "read", "readtext", "reconfigure", "references", "replication",
            "restore", "restrict", "return", "revert", "revoke", "right", "rollback", "rowcount",
            "rowguidcol", "rule", "save", "schema", "securityaudit", "select",
            "semantickeyphrasetable", "semanticsimilaritydetailstable",
            "semanticsimilaritytable", "session_user", "set", "setuser", "shutdown", "some",
            "statistics", "system_user", "table", "tablesample", "textsize", "then", "to", "top",
            "tran", "transaction", "trigger", "truncate", "try_convert", "tsequal", "union",
            "unique", "unpivot", "update", "updatetext", "use", "user", "values", "varying",
            "view", "waitfor", "when", "where", "while", "with", "within", "writetext");

    private static final IDataTypeFactory SQLSERVER_TYPE_FACTORY = new MsSqlDataTypeFactory();

    /**
     * Creates the handler.
     */
    public SqlServerDialectHandler() {
        super(DataTypeFactoryMode.SQLSERVER, "[", "]", MAX_IDENTIFIER_LENGTH, RESERVED_WORDS);
    }

    @Override
    protected String typeName(ColumnType.Kind kind) {
        switch (kind) {
            case BOOLEAN:
                return "BIT";
            case SMALLINT:
                return "SMALLINT";
            case INT:
                return "INT";
            case BIGINT:
                return "BIGINT";
            case FLOAT:
                return "FLOAT";
            case DATE:
                return "DATE";
            case DATETIME:
                return "DATETIME";
            case DATETIME_WITH_FRACTION:
                return "DATETIME2";
            case VARCHAR_MAX:
                return "NVARCHAR(MAX)";
            default:
                throw new IllegalArgumentException("Unexpected kind: " + kind);
        }
    }

    @Override
    protected String varcharTypeName() {
        return "NVARCHAR";
    }

    /**
     * Maps SQL Server columns. {@code datetime} and {@code smalldatetime} report fractional digits
     * but hold whole-second precision at best, so they read back as DATETIME.
     */
    @Override
    public ColumnType fromJdbcType(int jdbcType, String typeName, int size, int decimalDigits) {
        String name = typeName == null ? "" : typeName.toLowerCase(Locale.ROOT);
        if ("datetime".equals(name) || "smalldatetime".equals(name)) {
            return ColumnType.dateTime();
        }
        return super.fromJdbcType(jdbcType, typeName, size, decimalDigits);
    }

    /**
     * Applies SQL Server session settings.
     *
     * @param connection JDBC connection
     * @throws SQLException on SQL errors
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET LANGUAGE us_english");
            st.execute("SET DATEFORMAT ymd");
        }
    }

    /**
     * Resolves SQL Server schema name.
     *
     * @param entry connection config entry
     * @return SQL Server default schema
     */
    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        return "dbo";
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return SQLSERVER_TYPE_FACTORY;
    }

    @Override
    protected String identityColumnType() {
        return "INT IDENTITY(1,1) PRIMARY KEY";
    }
}
