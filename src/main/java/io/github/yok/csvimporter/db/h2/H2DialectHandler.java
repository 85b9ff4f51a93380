package io.github.yok.csvimporter.db.h2;

import com.google.common.collect.ImmutableSet;
import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.config.DataTypeFactoryMode;
import io.github.yok.csvimporter.db.AbstractDbDialectHandler;
import io.github.yok.csvimporter.schema.ColumnType;
import java.util.Set;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;

/**
 * H2 dialect handler, used for embedded and in-memory databases.
 *
 * @author Yasuharu.Okawauchi
 */
public class H2DialectHandler extends AbstractDbDialectHandler {

    /**
     * Maximum identifier length.
     */
    public static final int MAX_IDENTIFIER_LENGTH = 256;

    /**
     * H2 keywords beyond the SQL standard set.
     */
    public static final Set<String> RESERVED_WORDS = ImmutableSet.of("array", "current_catalog",
            "current_path", "current_role", "current_schema", "day", "hour", "if", "ilike",
            "interval", "key", "limit", "localtime", "localtimestamp", "minus", "minute", "month",
            "offset", "qualify", "regexp", "row", "rownum", "second", "top", "value", "window",
            "year", "_rowid_");

    private static final IDataTypeFactory H2_TYPE_FACTORY = new H2DataTypeFactory();

    /**
     * Creates the handler.
     */
    public H2DialectHandler() {
        super(DataTypeFactoryMode.H2, "\"", "\"", MAX_IDENTIFIER_LENGTH, RESERVED_WORDS);
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
                return "TIMESTAMP(9)";
            case VARCHAR_MAX:
                return "CHARACTER VARYING";
            default:
                throw new IllegalArgumentException("Unexpected kind: " + kind);
        }
    }

    @Override
    protected String decimalTypeName() {
        return "NUMERIC";
    }

    /**
     * Resolves the H2 schema.
     *
     * @param entry connection config entry
     * @return {@code PUBLIC}
     */
    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        return "PUBLIC";
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return H2_TYPE_FACTORY;
    }
}
