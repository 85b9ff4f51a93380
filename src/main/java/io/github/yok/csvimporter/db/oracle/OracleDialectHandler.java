package io.github.yok.csvimporter.db.oracle;

import com.google.common.collect.ImmutableSet;
import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.config.DataTypeFactoryMode;
import io.github.yok.csvimporter.db.AbstractDbDialectHandler;
import io.github.yok.csvimporter.schema.ColumnType;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.Locale;
import java.util.Set;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.oracle.Oracle10DataTypeFactory;

/**
 * Oracle dialect handler.
 *
 * <p>
 * Oracle has no native boolean or integer types; they are stored as {@code NUMBER} with a fixed
 * precision and read back by that precision. Oracle {@code DATE} carries a time of day and is read
 * back as DATETIME.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class OracleDialectHandler extends AbstractDbDialectHandler {

    /**
     * Maximum identifier length (12.2 and later).
     */
    public static final int MAX_IDENTIFIER_LENGTH = 128;

    /**
     * Oracle reserved words beyond the SQL standard set.
     */
    public static final Set<String> RESERVED_WORDS = ImmutableSet.of("access", "add", "audit",
            "char", "cluster", "comment", "compress", "connect", "current", "date", "decimal",
            "exclusive", "file", "float", "identified", "immediate", "increment", "index",
            "initial", "integer", "level", "lock", "long", "maxextents", "minus", "mlslabel",
            "mode", "modify", "noaudit", "nocompress", "nowait", "number", "of", "offline",
            "online", "option", "pctfree", "prior", "privileges", "public", "raw", "rename",
            "resource", "revoke", "row", "rowid", "rownum", "rows", "share", "size", "smallint",
            "start", "successful", "synonym", "sysdate", "trigger", "uid", "validate", "varchar",
            "varchar2", "view", "whenever");

    // Oracle-specific JDBC type codes of BINARY_FLOAT and BINARY_DOUBLE
    private static final int ORACLE_BINARY_FLOAT = 100;
    private static final int ORACLE_BINARY_DOUBLE = 101;

    private static final IDataTypeFactory ORACLE_TYPE_FACTORY = new Oracle10DataTypeFactory();

    /**
     * Creates the handler.
     */
    public OracleDialectHandler() {
        super(DataTypeFactoryMode.ORACLE, "\"", "\"", MAX_IDENTIFIER_LENGTH, RESERVED_WORDS);
    }

    @Override
    protected String typeName(ColumnType.Kind kind) {
        switch (kind) {
            case BOOLEAN:
                return "NUMBER(1)";
            case SMALLINT:
                return "NUMBER(5)";
            case INT:
                return "NUMBER(10)";
            case BIGINT:
                return "NUMBER(19)";
            case FLOAT:
                return "BINARY_DOUBLE";
            case DATE:
                return "DATE";
            case DATETIME:
                return "TIMESTAMP(0)";
            case DATETIME_WITH_FRACTION:
                return "TIMESTAMP(9)";
            case VARCHAR_MAX:
                return "NCLOB";
            default:
                throw new IllegalArgumentException("Unexpected kind: " + kind);
        }
    }

    @Override
    protected String decimalTypeName() {
        return "NUMBER";
    }

    @Override
    protected String varcharTypeName() {
        return "NVARCHAR2";
    }

    @Override
    public ColumnType fromJdbcType(int jdbcType, String typeName, int size, int decimalDigits) {
        String name = typeName == null ? "" : typeName.toUpperCase(Locale.ROOT);
        if (jdbcType == ORACLE_BINARY_FLOAT || jdbcType == ORACLE_BINARY_DOUBLE
                || name.startsWith("BINARY_")) {
            return ColumnType.floatType();
        }
        if ("DATE".equals(name)) {
            return ColumnType.dateTime();
        }
        if ((jdbcType == Types.NUMERIC || jdbcType == Types.DECIMAL) && decimalDigits == 0) {
            switch (size) {
                case 1:
                    return ColumnType.booleanType();
                case 5:
                    return ColumnType.smallInt();
                case 10:
                    return ColumnType.integer();
                case 19:
                    return ColumnType.bigInt();
                default:
                    break;
            }
        }
        return super.fromJdbcType(jdbcType, typeName, size, decimalDigits);
    }

    @Override
    public boolean isBooleanNumeric() {
        return true;
    }

    /**
     * Applies Oracle session settings.
     *
     * @param connection JDBC connection
     * @throws SQLException on SQL errors
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("ALTER SESSION SET NLS_DATE_FORMAT = 'YYYY-MM-DD HH24:MI:SS'");
            stmt.execute("ALTER SESSION SET NLS_TIMESTAMP_FORMAT = 'YYYY-MM-DD HH24:MI:SS.FF'");
            stmt.execute("ALTER SESSION SET NLS_NUMERIC_CHARACTERS = '.,'");
        }
    }

    /**
     * Resolves the Oracle schema: the connecting user, upper-cased.
     *
     * @param entry connection config entry
     * @return schema name
     */
    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        return entry.getUser() == null ? null : entry.getUser().toUpperCase(Locale.ROOT);
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return ORACLE_TYPE_FACTORY;
    }

    @Override
    protected String identityColumnType() {
        return "NUMBER(10) GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
    }
}
