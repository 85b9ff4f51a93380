package io.github.yok.csvimporter.db;

import com.google.common.collect.ImmutableSet;
import io.github.yok.csvimporter.config.DataTypeFactoryMode;
import io.github.yok.csvimporter.schema.ColumnDefinition;
import io.github.yok.csvimporter.schema.ColumnType;
import io.github.yok.csvimporter.schema.IdentifierRules;
import io.github.yok.csvimporter.schema.TableSchema;
import java.sql.Types;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Behavior shared by all dialects: identifier quoting, DDL rendering and the mapping of standard
 * JDBC types back to column types.
 *
 * <p>
 * Subclasses supply the SQL type names of each column kind, their identifier limits and their
 * reserved words.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class AbstractDbDialectHandler implements DbDialectHandler {

    /**
     * Words reserved by the SQL standard, rejected as column names on every database.
     */
    public static final Set<String> STANDARD_RESERVED_WORDS = ImmutableSet.of("all", "alter",
            "and", "any", "as", "asc", "between", "by", "case", "check", "column", "constraint",
            "create", "cross", "current_date", "current_time", "current_timestamp", "current_user",
            "default", "delete", "desc", "distinct", "drop", "else", "end", "except", "exists",
            "false", "fetch", "for", "foreign", "from", "full", "grant", "group", "having", "in",
            "inner", "insert", "intersect", "into", "is", "join", "left", "like", "natural", "not",
            "null", "on", "or", "order", "outer", "primary", "references", "right", "select",
            "session_user", "set", "some", "table", "then", "to", "true", "union", "unique",
            "update", "user", "using", "values", "when", "where", "with");

    // Text columns wider than this are treated as unbounded when read back
    static final int UNBOUNDED_TEXT_SIZE = 4000;

    private final DataTypeFactoryMode mode;
    private final String quoteOpen;
    private final String quoteClose;
    private final IdentifierRules identifierRules;

    /**
     * Creates a handler.
     *
     * @param mode database type
     * @param quoteOpen opening identifier quote
     * @param quoteClose closing identifier quote
     * @param maxIdentifierLength maximum identifier length
     * @param reservedWords reserved words in addition to {@link #STANDARD_RESERVED_WORDS}
     */
    protected AbstractDbDialectHandler(DataTypeFactoryMode mode, String quoteOpen,
            String quoteClose, int maxIdentifierLength, Set<String> reservedWords) {
        this.mode = mode;
        this.quoteOpen = quoteOpen;
        this.quoteClose = quoteClose;
        this.identifierRules = new IdentifierRules(maxIdentifierLength,
                IdentifierRules.UNICODE_WORD_CHARACTERS, STANDARD_RESERVED_WORDS)
                        .withReservedWords(reservedWords);
    }

    /**
     * SQL type name of a kind without parameters.
     *
     * @param kind column kind other than DECIMAL and VARCHAR
     * @return SQL type name
     */
    protected abstract String typeName(ColumnType.Kind kind);

    /**
     * SQL type name of fixed-point decimals, rendered as {@code NAME(p, s)}.
     *
     * @return type name
     */
    protected String decimalTypeName() {
        return "DECIMAL";
    }

    /**
     * SQL type name of bounded text, rendered as {@code NAME(n)}.
     *
     * @return type name
     */
    protected String varcharTypeName() {
        return "VARCHAR";
    }

    /**
     * Column definition of a generated integer primary key, without the column name.
     *
     * @return type and constraint clause
     */
    protected String identityColumnType() {
        return "INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
    }

    @Override
    public DataTypeFactoryMode getMode() {
        return mode;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return quoteOpen + identifier.replace(quoteClose, quoteClose + quoteClose) + quoteClose;
    }

    @Override
    public String getEscapePattern() {
        return quoteOpen + "?" + quoteClose;
    }

    @Override
    public IdentifierRules getIdentifierRules() {
        return identifierRules;
    }

    @Override
    public String toSqlType(ColumnType type) {
        switch (type.getKind()) {
            case DECIMAL:
                return decimalTypeName() + "(" + type.getPrecision() + ", " + type.getScale()
                        + ")";
            case VARCHAR:
                return varcharTypeName() + "(" + type.getLength() + ")";
            default:
                return typeName(type.getKind());
        }
    }

    @Override
    public String buildCreateTableSql(TableSchema schema) {
        Stream<String> columnSql = schema.getColumns().stream().map(this::columnDefinition);
        if (schema.getIdentityColumn() != null) {
            columnSql = Stream.concat(Stream.of(quoteIdentifier(schema.getIdentityColumn()) + " "
                    + identityColumnType()), columnSql);
        }
        String columns = columnSql.collect(Collectors.joining(",\n    "));
        return "CREATE TABLE " + qualifyTable(schema.getSchema(), schema.getTableName())
                + " (\n    " + columns + "\n)";
    }

    @Override
    public ColumnType fromJdbcType(int jdbcType, String typeName, int size, int decimalDigits) {
        switch (jdbcType) {
            case Types.BIT:
            case Types.BOOLEAN:
                return ColumnType.booleanType();
            case Types.TINYINT:
            case Types.REAL:
                // Narrower than SMALLINT and FLOAT; no inferred type fits without overflow
                return null;
            case Types.SMALLINT:
                return ColumnType.smallInt();
            case Types.INTEGER:
                return ColumnType.integer();
            case Types.BIGINT:
                return ColumnType.bigInt();
            case Types.FLOAT:
            case Types.DOUBLE:
                return ColumnType.floatType();
            case Types.NUMERIC:
            case Types.DECIMAL:
                return decimalOf(size, decimalDigits);
            case Types.DATE:
                return ColumnType.date();
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return decimalDigits > 0 ? ColumnType.dateTimeWithFraction()
                        : ColumnType.dateTime();
            case Types.CHAR:
            case Types.NCHAR:
            case Types.VARCHAR:
            case Types.NVARCHAR:
                return size <= 0 || size > UNBOUNDED_TEXT_SIZE ? ColumnType.varcharMax()
                        : ColumnType.varchar(size);
            case Types.LONGVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.CLOB:
            case Types.NCLOB:
                return ColumnType.varcharMax();
            default:
                return null;
        }
    }

    /**
     * Decimal type for a reported precision and scale, or {@code null} when out of range.
     *
     * @param precision reported precision
     * @param scale reported scale
     * @return decimal type or {@code null}
     */
    protected ColumnType decimalOf(int precision, int scale) {
        if (precision < 1 || precision > ColumnType.MAX_DECIMAL_PRECISION || scale < 0
                || scale > precision) {
            return null;
        }
        return ColumnType.decimal(precision, scale);
    }

    private String columnDefinition(ColumnDefinition column) {
        return quoteIdentifier(column.getName()) + " " + toSqlType(column.getType());
    }
}
