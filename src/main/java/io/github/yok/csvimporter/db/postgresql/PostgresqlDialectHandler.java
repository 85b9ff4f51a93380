package io.github.yok.csvimporter.db.postgresql;

import com.google.common.collect.ImmutableSet;
import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.config.DataTypeFactoryMode;
import io.github.yok.csvimporter.db.AbstractDbDialectHandler;
import io.github.yok.csvimporter.schema.ColumnType;
import java.util.Set;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;

/**
 * PostgreSQL dialect handler.
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresqlDialectHandler extends AbstractDbDialectHandler {

    /**
     * Maximum identifier length ({@code NAMEDATALEN - 1}).
     */
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    /**
     * PostgreSQL reserved key words beyond the SQL standard set.
     */
    public static final Set<String> RESERVED_WORDS = ImmutableSet.of("analyse", "analyze",
            "array", "asymmetric", "both", "cast", "collate", "current_catalog", "current_role",
            "deferrable", "do", "initially", "lateral", "leading", "limit", "localtime",
            "localtimestamp", "offset", "only", "placing", "returning", "symmetric", "trailing",
            "variadic", "window");

    private static final IDataTypeFactory POSTGRESQL_TYPE_FACTORY =
            new PostgresqlDataTypeFactory();

    /**
     * Creates the handler.
     */
    public PostgresqlDialectHandler() {
        super(DataTypeFactoryMode.POSTGRESQL, "\"", "\"", MAX_IDENTIFIER_LENGTH, RESERVED_WORDS);
    }

    @Override
    protected String typeName(ColumnType.Kind kind) {
        switch (kind) {
            case BOOLEAN:
                return "BOOLEAN";
            case SMALLINT:
                return "SMALLINT";
            case INT:
                return "INTEGER";
            case BIGINT:
                return "BIGINT";
            case FLOAT:
                return "DOUBLE PRECISION";
            case DATE:
                return "DATE";
            case DATETIME:
                return "TIMESTAMP(0)";
            case DATETIME_WITH_FRACTION:
                return "TIMESTAMP(6)";
            case VARCHAR_MAX:
                return "TEXT";
            default:
                throw new IllegalArgumentException("Unexpected kind: " + kind);
        }
    }

    @Override
    protected String decimalTypeName() {
        return "NUMERIC";
    }

    /**
     * Resolves PostgreSQL schema name.
     *
     * @param entry connection config entry
     * @return {@code public}
     */
    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        return "public";
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return POSTGRESQL_TYPE_FACTORY;
    }
}
